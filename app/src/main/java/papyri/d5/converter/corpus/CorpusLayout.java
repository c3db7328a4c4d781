package papyri.d5.converter.corpus;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Locations of the local corpus copy.
 *
 * @param dataRoot    directory holding downloads and the TM index
 * @param idpDataPath checkout of the idp.data repository, containing {@code DCLP} and {@code DDB_EpiDoc_XML}
 * @param tmIndexPath JSON file mapping TM numbers to XML files
 */
public record CorpusLayout(Path dataRoot, Path idpDataPath, Path tmIndexPath) {

    public static final String DEFAULT_DATA_ROOT = "papyri_data";
    static final String ARCHIVE_ROOT = "idp.data-master";
    static final String TM_INDEX_FILE = "tm_index.json";
    static final String DCLP = "DCLP";
    static final String DDB = "DDB_EpiDoc_XML";

    public CorpusLayout {
        Objects.requireNonNull(dataRoot, "dataRoot");
        idpDataPath = idpDataPath == null ? dataRoot.resolve(ARCHIVE_ROOT) : idpDataPath;
        tmIndexPath = tmIndexPath == null ? dataRoot.resolve(TM_INDEX_FILE) : tmIndexPath;
    }

    public static CorpusLayout under(Path dataRoot) {
        return new CorpusLayout(dataRoot, null, null);
    }

    /**
     * True if the corpus lives where the downloader extracts it, in which case a missing copy is fetched.
     */
    public boolean usesDownloadedCopy() {
        return idpDataPath.normalize().equals(dataRoot.resolve(ARCHIVE_ROOT).normalize());
    }

    public Path dclpDirectory() {
        return idpDataPath.resolve(DCLP);
    }

    public Path ddbDirectory() {
        return idpDataPath.resolve(DDB);
    }
}
