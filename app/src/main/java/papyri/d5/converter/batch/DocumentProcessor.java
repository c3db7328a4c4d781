package papyri.d5.converter.batch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import papyri.d5.converter.convert.ConversionException;
import papyri.d5.converter.convert.ConversionResult;
import papyri.d5.converter.convert.D5Converter;
import papyri.d5.converter.corpus.TmIndex;
import papyri.d5.converter.writer.ResultWriter;

/**
 * Converts and writes every file of one TM number.
 */
public class DocumentProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentProcessor.class);
    static final String MDC_TM = "tm";

    private final TmIndex index;
    private final D5Converter converter;
    private final List<ResultWriter> writers;
    private final boolean ignoreFormattingIssues;

    public DocumentProcessor(TmIndex index, D5Converter converter, List<ResultWriter> writers,
            boolean ignoreFormattingIssues) {
        this.index = Objects.requireNonNull(index, "index");
        this.converter = Objects.requireNonNull(converter, "converter");
        this.writers = List.copyOf(writers);
        this.ignoreFormattingIssues = ignoreFormattingIssues;
    }

    /**
     * Files are processed in path order; the first file with validation problems ends processing of the TM
     * unless formatting issues are ignored.
     */
    public ProcessingOutcome process(int tm) {
        MDC.put(MDC_TM, String.valueOf(tm));
        try {
            List<Path> files = index.pathsFor(tm);
            if (files.isEmpty()) {
                return ProcessingOutcome.skipped(tm,
                        "Could not find any XML file(s) associated with TM number " + tm + ".");
            }
            List<Path> written = new ArrayList<>();
            for (Path file : files) {
                LOGGER.debug("Processing {} (TM {})", file, tm);
                ConversionResult result;
                try {
                    result = converter.convert(file);
                } catch (ConversionException ex) {
                    return ProcessingOutcome.skipped(tm, ex.getMessage());
                }
                if (result.isEmpty()) {
                    LOGGER.debug("No text found in {}", file);
                    continue;
                }
                if (result.hasDiagnostics() && !ignoreFormattingIssues) {
                    return ProcessingOutcome.skipped(tm,
                            "TM " + tm + " skipped due to formatting errors: " + result.diagnostics());
                }
                String sourceName = sourceName(file);
                for (ResultWriter writer : writers) {
                    Path target = writer.write(tm, sourceName, result);
                    LOGGER.debug("Wrote {}", target);
                    written.add(target);
                }
            }
            return ProcessingOutcome.completed(tm, written);
        } finally {
            MDC.remove(MDC_TM);
        }
    }

    private static String sourceName(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".xml") ? name.substring(0, name.length() - ".xml".length()) : name;
    }
}
