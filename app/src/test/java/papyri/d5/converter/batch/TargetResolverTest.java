package papyri.d5.converter.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import papyri.d5.converter.config.Target;
import papyri.d5.converter.corpus.CollectionSelector;
import papyri.d5.converter.corpus.CorpusLayout;
import papyri.d5.converter.corpus.FilterSource;
import papyri.d5.converter.corpus.PapyrusFilter;

class TargetResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void namesSingleTmAfterItsNumber() {
        ResolvedTarget resolved = resolver().resolve(new Target.TmNumbers(List.of(42)));

        assertThat(resolved.exportDirectory()).isEqualTo("42");
        assertThat(resolved.tmNumbers()).containsExactly(42);
    }

    @Test
    void namesTmListAfterItsRange() {
        ResolvedTarget resolved = resolver().resolve(new Target.TmNumbers(List.of(9, 3, 5, 3)));

        assertThat(resolved.exportDirectory()).isEqualTo("3-9");
        assertThat(resolved.tmNumbers()).containsExactly(3, 5, 9);
    }

    @Test
    void joinsCollectionNames() {
        ResolvedTarget resolved = resolver().resolve(new Target.CollectionNames(List.of("bgu", "p.oxy")));

        assertThat(resolved.exportDirectory()).isEqualTo("bgu+p.oxy");
        assertThat(resolved.tmNumbers()).containsExactly(1, 2);
    }

    @Test
    void namesFilterAfterTheFilter() {
        PapyrusFilter filter = new PapyrusFilter(FilterSource.ALL, "oxy", null, null, true, "oxy-texts");

        ResolvedTarget resolved = resolver().resolve(new Target.Filter(filter));

        assertThat(resolved.exportDirectory()).isEqualTo("oxy-texts");
        assertThat(resolved.tmNumbers()).isEmpty();
    }

    @Test
    void singleFileHasNoTmNumbers() {
        assertThatThrownBy(() -> resolver().resolve(new Target.SingleFile(tempDir.resolve("a.xml"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private TargetResolver resolver() {
        CorpusLayout layout = CorpusLayout.under(tempDir);
        return new TargetResolver(layout, new FixedCollectionSelector(layout));
    }

    private static final class FixedCollectionSelector extends CollectionSelector {

        FixedCollectionSelector(CorpusLayout layout) {
            super(layout);
        }

        @Override
        public List<Integer> tmNumbers(Collection<String> names) {
            return List.of(1, 2);
        }
    }
}
