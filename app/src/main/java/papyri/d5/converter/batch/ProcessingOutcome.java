package papyri.d5.converter.batch;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * What happened to one TM number.
 *
 * @param message the reason a TM was skipped, empty otherwise
 */
public record ProcessingOutcome(int tm, Status status, String message, List<Path> writtenFiles) {

    public enum Status {
        WRITTEN,
        NOTHING_TO_WRITE,
        SKIPPED
    }

    public ProcessingOutcome {
        Objects.requireNonNull(status, "status");
        message = message == null ? "" : message;
        writtenFiles = writtenFiles == null ? List.of() : List.copyOf(writtenFiles);
    }

    static ProcessingOutcome skipped(int tm, String message) {
        return new ProcessingOutcome(tm, Status.SKIPPED, message, List.of());
    }

    static ProcessingOutcome completed(int tm, List<Path> writtenFiles) {
        return new ProcessingOutcome(tm, writtenFiles.isEmpty() ? Status.NOTHING_TO_WRITE : Status.WRITTEN, "",
                writtenFiles);
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }
}
