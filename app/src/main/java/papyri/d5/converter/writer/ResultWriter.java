package papyri.d5.converter.writer;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import papyri.d5.converter.config.OutputFormat;
import papyri.d5.converter.convert.ConversionResult;

/**
 * Persists the conversion result of one source file.
 */
public interface ResultWriter {

    /**
     * @param tm         TM number the source file belongs to
     * @param sourceName file name of the source without the {@code .xml} extension
     * @return the file written
     */
    Path write(int tm, String sourceName, ConversionResult result);

    static List<ResultWriter> forFormats(Collection<OutputFormat> formats, Path exportDirectory) {
        return formats.stream()
                .sorted()
                .<ResultWriter>map(format -> switch (format) {
                    case JSON -> new JsonResultWriter(exportDirectory.resolve(format.directoryName()));
                    case TXT -> new TextResultWriter(exportDirectory.resolve(format.directoryName()));
                })
                .collect(Collectors.toUnmodifiableList());
    }
}
