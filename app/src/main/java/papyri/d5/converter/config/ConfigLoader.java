package papyri.d5.converter.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import papyri.d5.converter.cli.CliArguments;
import papyri.d5.converter.corpus.CorpusLayout;
import papyri.d5.converter.corpus.FilterSource;
import papyri.d5.converter.corpus.PapyrusFilter;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_DATA_PATH = "PAPYRI_DATA_PATH";
    static final String ENV_IDP_DATA_PATH = "IDP_DATA_PATH";
    static final String ENV_EXPORT_PATH = "PAPYRI_EXPORT_PATH";
    static final String ENV_THREADS = "PAPYRI_THREADS";
    static final String ENV_OUTPUT_FORMATS = "PAPYRI_OUTPUT_FORMATS";
    static final String ENV_IGNORE_FORMATTING_ISSUES = "IGNORE_FORMATTING_ISSUES";
    static final String ENV_DEBUG = "PAPYRI_DEBUG";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_EXPORT_PATH = "export";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Target target = resolveTarget(arguments);

        Path dataRoot = resolvePath(arguments.dataPath(), ENV_DATA_PATH)
                .orElse(Paths.get(CorpusLayout.DEFAULT_DATA_ROOT));
        Path idpDataPath = resolvePath(arguments.idpDataPath(), ENV_IDP_DATA_PATH).orElse(null);
        Path exportRoot = resolvePath(arguments.exportPath(), ENV_EXPORT_PATH)
                .orElse(Paths.get(DEFAULT_EXPORT_PATH));

        Set<OutputFormat> outputFormats = resolveOutputFormats(arguments);
        boolean ignoreFormattingIssues = resolveFlag(arguments.ignoreFormattingIssues(), ENV_IGNORE_FORMATTING_ISSUES);
        boolean debug = resolveFlag(arguments.debug(), ENV_DEBUG);
        int threads = resolveThreads(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        return new Config(target, new CorpusLayout(dataRoot, idpDataPath, null), exportRoot, outputFormats,
                ignoreFormattingIssues, debug, threads, arguments.update(), arguments.reindex(), logFormat);
    }

    private Target resolveTarget(CliArguments arguments) {
        boolean hasTmNumbers = !arguments.tmNumbers().isEmpty();
        boolean hasCollections = !arguments.collections().isEmpty();
        boolean hasFilter = isNotBlank(arguments.title()) || isNotBlank(arguments.place())
                || isNotBlank(arguments.dclpHybrid());
        boolean hasFile = arguments.file() != null;
        long given = List.of(hasTmNumbers, hasCollections, hasFilter, hasFile).stream()
                .filter(Boolean::booleanValue)
                .count();
        if (given != 1) {
            throw new IllegalArgumentException(
                    "Exactly one target must be given: --tm, --collection, --title/--place/--dclp-hybrid or --file");
        }
        if (hasTmNumbers) {
            return new Target.TmNumbers(arguments.tmNumbers());
        }
        if (hasCollections) {
            return new Target.CollectionNames(arguments.collections());
        }
        if (hasFile) {
            return new Target.SingleFile(arguments.file());
        }
        FilterSource source = arguments.source() == null ? FilterSource.ALL : arguments.source();
        return new Target.Filter(new PapyrusFilter(source, arguments.title(), arguments.place(),
                arguments.dclpHybrid(), !arguments.requireAllCriteria(), arguments.filterName()));
    }

    private Optional<Path> resolvePath(Path cliValue, String envKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(Paths::get);
    }

    private Set<OutputFormat> resolveOutputFormats(CliArguments arguments) {
        if (!arguments.outputFormats().isEmpty()) {
            return EnumSet.copyOf(arguments.outputFormats());
        }
        return environmentReader.get(ENV_OUTPUT_FORMATS)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parseOutputFormats)
                .orElse(EnumSet.allOf(OutputFormat.class));
    }

    private boolean resolveFlag(boolean cliValue, String envKey) {
        if (cliValue) {
            return true;
        }
        return environmentReader.get(envKey)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private int resolveThreads(CliArguments arguments) {
        Integer threads = arguments.threads();
        if (threads != null) {
            if (threads < 1) {
                throw new IllegalArgumentException("--threads must be at least 1");
            }
            return threads;
        }
        return environmentReader.get(ENV_THREADS)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parsePositiveInteger)
                .orElse(Runtime.getRuntime().availableProcessors());
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private static int parsePositiveInteger(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_THREADS + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_THREADS + " must be an integer", ex);
        }
    }

    private static Set<OutputFormat> parseOutputFormats(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(OutputFormat::from)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(OutputFormat.class)));
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
