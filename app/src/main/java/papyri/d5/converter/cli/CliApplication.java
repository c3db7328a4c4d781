package papyri.d5.converter.cli;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import papyri.d5.converter.batch.BatchRunner;
import papyri.d5.converter.batch.DocumentProcessor;
import papyri.d5.converter.batch.ProcessingOutcome;
import papyri.d5.converter.batch.ResolvedTarget;
import papyri.d5.converter.batch.TargetResolver;
import papyri.d5.converter.config.Config;
import papyri.d5.converter.config.ConfigLoader;
import papyri.d5.converter.config.EnvironmentReader;
import papyri.d5.converter.config.Target;
import papyri.d5.converter.convert.ConversionException;
import papyri.d5.converter.convert.ConversionResult;
import papyri.d5.converter.convert.D5Converter;
import papyri.d5.converter.convert.TextBlock;
import papyri.d5.converter.corpus.CorpusDownloader;
import papyri.d5.converter.corpus.CorpusException;
import papyri.d5.converter.corpus.CorpusLayout;
import papyri.d5.converter.corpus.TmIndex;
import papyri.d5.converter.logging.LoggingConfigurator;
import papyri.d5.converter.transform.FileUnimplementedMarkupRecorder;
import papyri.d5.converter.transform.TagTransformer;
import papyri.d5.converter.transform.UnimplementedMarkupRecorder;
import papyri.d5.converter.writer.ResultWriter;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the conversion pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final Path UNIMPLEMENTED_MARKUP_FILE = Paths.get("dev", "not_yet_implemented.txt");
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final CorpusDownloader downloader;
    private final PrintWriter out;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), new CorpusDownloader(), new PrintWriter(System.out, true));
    }

    CliApplication(ConfigLoader configLoader, CorpusDownloader downloader, PrintWriter out) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.downloader = Objects.requireNonNull(downloader, "downloader");
        this.out = Objects.requireNonNull(out, "out");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            return EXIT_FAILURE;
        }
        LoggingConfigurator.configure(config.logFormat(), config.debug());

        try {
            D5Converter converter = new D5Converter(new TagTransformer(markupRecorder(config)));
            if (config.target() instanceof Target.SingleFile singleFile) {
                printConversion(converter.convert(singleFile.file()));
                return 0;
            }
            runBatch(config, converter);
            return 0;
        } catch (ConversionException | CorpusException | UncheckedIOException ex) {
            LOGGER.error(ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private void runBatch(Config config, D5Converter converter) {
        CorpusLayout layout = config.corpusLayout();
        if ((layout.usesDownloadedCopy() && !Files.exists(layout.idpDataPath())) || config.alwaysUpdate()) {
            downloader.download(layout);
        }
        TmIndex index = TmIndex.loadOrBuild(layout, config.alwaysIndex());
        ResolvedTarget resolved = new TargetResolver(layout).resolve(config.target());
        List<ResultWriter> writers = ResultWriter.forFormats(config.outputFormats(),
                config.exportRoot().resolve(resolved.exportDirectory()));
        DocumentProcessor processor = new DocumentProcessor(index, converter, writers,
                config.ignoreFormattingIssues());
        List<ProcessingOutcome> outcomes = new BatchRunner(processor, config.workerThreads())
                .run(resolved.tmNumbers());
        LOGGER.info("Results written below {}", config.exportRoot().resolve(resolved.exportDirectory()));
        LOGGER.debug("Outcomes: {}", outcomes);
    }

    // the registry of a previous run is always discarded, a new one is only kept in debug runs
    private static UnimplementedMarkupRecorder markupRecorder(Config config) {
        FileUnimplementedMarkupRecorder recorder = new FileUnimplementedMarkupRecorder(UNIMPLEMENTED_MARKUP_FILE);
        recorder.reset();
        return config.debug() ? recorder : UnimplementedMarkupRecorder.NONE;
    }

    private void printConversion(ConversionResult result) {
        List<TextBlock> blocks = result.blocks();
        for (int i = 0; i < blocks.size(); i++) {
            if (i > 0) {
                out.println();
            }
            blocks.get(i).lines().forEach(out::println);
        }
        for (String diagnostic : result.diagnostics()) {
            out.println("! " + diagnostic);
        }
        out.flush();
    }
}
