package papyri.d5.converter.corpus;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class CorpusLayoutTest {

    @Test
    void defaultsLiveUnderTheDataRoot() {
        CorpusLayout layout = CorpusLayout.under(Path.of("papyri_data"));

        assertThat(layout.idpDataPath()).isEqualTo(Path.of("papyri_data", "idp.data-master"));
        assertThat(layout.tmIndexPath()).isEqualTo(Path.of("papyri_data", "tm_index.json"));
        assertThat(layout.dclpDirectory()).isEqualTo(Path.of("papyri_data", "idp.data-master", "DCLP"));
        assertThat(layout.ddbDirectory()).isEqualTo(Path.of("papyri_data", "idp.data-master", "DDB_EpiDoc_XML"));
        assertThat(layout.usesDownloadedCopy()).isTrue();
    }

    @Test
    void externalCheckoutIsNotDownloaded() {
        CorpusLayout layout = new CorpusLayout(Path.of("papyri_data"), Path.of("/srv/idp.data"), null);

        assertThat(layout.usesDownloadedCopy()).isFalse();
        assertThat(layout.ddbDirectory()).isEqualTo(Path.of("/srv/idp.data", "DDB_EpiDoc_XML"));
    }
}
