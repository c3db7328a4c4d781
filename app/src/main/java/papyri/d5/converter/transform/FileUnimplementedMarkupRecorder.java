package papyri.d5.converter.transform;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends each distinct unimplemented markup description once to a text file. Safe for concurrent workers.
 */
public class FileUnimplementedMarkupRecorder implements UnimplementedMarkupRecorder {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileUnimplementedMarkupRecorder.class);

    private final Path file;
    private final Set<String> recorded = new HashSet<>();

    public FileUnimplementedMarkupRecorder(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    /**
     * Removes the file left by a previous run.
     */
    public void reset() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to reset " + file, ex);
        }
        synchronized (recorded) {
            recorded.clear();
        }
    }

    @Override
    public void record(String description) {
        synchronized (recorded) {
            if (!recorded.add(description)) {
                return;
            }
            try {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(file, description + "\n", StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to record unimplemented markup in " + file, ex);
            }
        }
        LOGGER.debug("Recorded unimplemented markup: {}", description);
    }

    public Path file() {
        return file;
    }
}
