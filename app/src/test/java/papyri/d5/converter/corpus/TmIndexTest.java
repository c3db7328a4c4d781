package papyri.d5.converter.corpus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TmIndexTest {

    @TempDir
    Path tempDir;

    @Test
    void buildsIndexFromBothCollections() throws Exception {
        CorpusLayout layout = CorpusLayout.under(tempDir);
        Path dclp = EpiDocFixtures.write(layout.dclpDirectory().resolve("DCLP/1/10.xml"), "10", "A", "Oxy", "h");
        Path ddb = EpiDocFixtures.write(layout.ddbDirectory().resolve("bgu/bgu.1/bgu.1.1.xml"), "20 10", "B", "Ars", null);
        Files.writeString(layout.ddbDirectory().resolve("bgu/readme.txt"), "not xml");

        TmIndex index = TmIndex.build(layout);

        assertThat(index.tmNumbers()).containsExactly(10, 20);
        assertThat(index.pathsFor(10)).containsExactlyInAnyOrder(dclp, ddb);
        assertThat(index.pathsFor(20)).containsExactly(ddb);
        assertThat(index.pathsFor(30)).isEmpty();
    }

    @Test
    void buildFailsWithoutXmlFiles() {
        CorpusLayout layout = CorpusLayout.under(tempDir);

        assertThatThrownBy(() -> TmIndex.build(layout))
                .isInstanceOf(CorpusException.class)
                .hasMessageContaining("Indexing failed");
    }

    @Test
    void savesAndLoadsEntries() {
        Path file = tempDir.resolve("nested").resolve("tm_index.json");
        TmIndex index = new TmIndex(List.of(new TmIndexEntry(5, "a.xml"), new TmIndexEntry(5, "b.xml"),
                new TmIndexEntry(7, "c.xml")));

        index.save(file);
        TmIndex loaded = TmIndex.load(file);

        assertThat(loaded.entries()).isEqualTo(index.entries());
        assertThat(loaded.pathsFor(5)).containsExactly(Path.of("a.xml"), Path.of("b.xml"));
    }

    @Test
    void loadOrBuildPrefersThePersistedIndex() throws Exception {
        CorpusLayout layout = CorpusLayout.under(tempDir);
        EpiDocFixtures.write(layout.ddbDirectory().resolve("bgu/bgu.1.1.xml"), "20", "B", "Ars", null);
        new TmIndex(List.of(new TmIndexEntry(99, "old.xml"))).save(layout.tmIndexPath());

        assertThat(TmIndex.loadOrBuild(layout, false).tmNumbers()).containsExactly(99);
        assertThat(TmIndex.loadOrBuild(layout, true).tmNumbers()).containsExactly(20);
        assertThat(TmIndex.load(layout.tmIndexPath()).tmNumbers()).containsExactly(20);
    }

    @Test
    void corruptIndexFails() throws Exception {
        Path file = tempDir.resolve("tm_index.json");
        Files.writeString(file, "{not json");

        assertThatThrownBy(() -> TmIndex.load(file)).isInstanceOf(CorpusException.class);
    }
}
