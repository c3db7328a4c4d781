package papyri.d5.converter.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import papyri.d5.converter.convert.ConversionResult;

/**
 * Writes {@code <tm>_<source>.txt}: every line of every block, newline separated, without a trailing newline.
 */
public class TextResultWriter implements ResultWriter {

    private final Path directory;

    public TextResultWriter(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public Path write(int tm, String sourceName, ConversionResult result) {
        Path target = directory.resolve(tm + "_" + sourceName + ".txt");
        try {
            Files.createDirectories(directory);
            Files.writeString(target, String.join("\n", result.lines()), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write converted document: " + target, ex);
        }
        return target;
    }
}
