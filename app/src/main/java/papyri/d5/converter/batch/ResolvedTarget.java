package papyri.d5.converter.batch;

import java.util.List;
import java.util.Objects;

/**
 * TM numbers to process and the directory below the export root their results go to.
 */
public record ResolvedTarget(String exportDirectory, List<Integer> tmNumbers) {

    public ResolvedTarget {
        Objects.requireNonNull(exportDirectory, "exportDirectory");
        tmNumbers = List.copyOf(tmNumbers);
    }
}
