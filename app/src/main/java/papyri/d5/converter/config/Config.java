package papyri.d5.converter.config;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import papyri.d5.converter.corpus.CorpusLayout;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Target target,
        CorpusLayout corpusLayout,
        Path exportRoot,
        Set<OutputFormat> outputFormats,
        boolean ignoreFormattingIssues,
        boolean debug,
        int threads,
        boolean alwaysUpdate,
        boolean alwaysIndex,
        LogFormat logFormat
) {

    public Config {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(corpusLayout, "corpusLayout");
        Objects.requireNonNull(exportRoot, "exportRoot");
        outputFormats = outputFormats == null || outputFormats.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.allOf(OutputFormat.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(outputFormats));
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }

    /**
     * Debug runs process one TM at a time so their log stays readable.
     */
    public int workerThreads() {
        return debug ? 1 : threads;
    }
}
