package papyri.d5.converter.corpus;

import java.util.Objects;

/**
 * One TM number found in one EpiDoc file.
 */
public record TmIndexEntry(int tm, String path) {

    public TmIndexEntry {
        Objects.requireNonNull(path, "path");
    }
}
