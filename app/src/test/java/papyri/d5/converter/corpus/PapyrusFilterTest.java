package papyri.d5.converter.corpus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PapyrusFilterTest {

    @TempDir
    Path tempDir;

    @Test
    void requiresAtLeastOneCriterion() {
        assertThatThrownBy(() -> new PapyrusFilter(FilterSource.ALL, " ", null, null, true, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("title, place, or dclp-hybrid must be set");
    }

    @Test
    void dclpHybridDoesNotApplyToDdb() {
        assertThatThrownBy(() -> new PapyrusFilter(FilterSource.DDB, null, null, "p.oxy", true, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void derivesNameFromCriteria() {
        PapyrusFilter filter = new PapyrusFilter(FilterSource.DCLP, "oxy", null, null, false, "");

        assertThat(filter.name()).isEqualTo("filter-dclp-oxy-null-null-false");
        assertThat(new PapyrusFilter(FilterSource.ALL, "oxy", null, null, true, "mine").name()).isEqualTo("mine");
    }

    @Test
    void matchesCaseInsensitiveSubstrings() {
        EpiDocHeader header = header("P.Oxy. 1 1", "Oxyrhynchos", "p.oxy;1;1");

        assertThat(new PapyrusFilter(FilterSource.ALL, "p.oxy", null, null, true, null).matches(header, false)).isTrue();
        assertThat(new PapyrusFilter(FilterSource.ALL, null, "OXYRH", null, true, null).matches(header, false)).isTrue();
        assertThat(new PapyrusFilter(FilterSource.ALL, null, "Arsinoe", null, true, null).matches(header, false)).isFalse();
    }

    @Test
    void requireAllNeedsEveryGivenCriterion() {
        EpiDocHeader header = header("P.Oxy. 1 1", "Oxyrhynchos", null);

        assertThat(new PapyrusFilter(FilterSource.ALL, "oxy", "arsinoe", null, true, null).matches(header, false)).isTrue();
        assertThat(new PapyrusFilter(FilterSource.ALL, "oxy", "arsinoe", null, false, null).matches(header, false)).isFalse();
        assertThat(new PapyrusFilter(FilterSource.ALL, "oxy", "oxyrh", null, false, null).matches(header, false)).isTrue();
    }

    @Test
    void dclpHybridOnlyMatchesDclpFiles() {
        EpiDocHeader header = header("t", "p", "p.oxy;1;1");
        PapyrusFilter filter = new PapyrusFilter(FilterSource.ALL, null, null, "p.oxy", true, null);

        assertThat(filter.matches(header, true)).isTrue();
        assertThat(filter.matches(header, false)).isFalse();
    }

    @Test
    void selectsTmNumbersFromTheChosenSource() throws Exception {
        CorpusLayout layout = CorpusLayout.under(tempDir);
        EpiDocFixtures.write(layout.dclpDirectory().resolve("1/1.xml"), "1", "P.Oxy. 1", "Oxyrhynchos", "p.oxy;1");
        EpiDocFixtures.write(layout.ddbDirectory().resolve("p.oxy/2.xml"), "2", "P.Oxy. 2", "Oxyrhynchos", null);
        EpiDocFixtures.write(layout.ddbDirectory().resolve("bgu/3.xml"), "3", "BGU 3", "Arsinoites", null);

        assertThat(new PapyrusFilter(FilterSource.ALL, null, "oxyrhynchos", null, true, null).select(layout))
                .containsExactly(1, 2);
        assertThat(new PapyrusFilter(FilterSource.DDB, "p.oxy", null, null, true, null).select(layout))
                .containsExactly(2);
        assertThat(new PapyrusFilter(FilterSource.DCLP, null, null, "p.oxy", true, null).select(layout))
                .containsExactly(1);
    }

    private static EpiDocHeader header(String title, String place, String hybrid) {
        return new EpiDocHeader(Set.of(1), Optional.ofNullable(title), Optional.ofNullable(place),
                Optional.ofNullable(hybrid));
    }
}
