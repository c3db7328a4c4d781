package papyri.d5.converter.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import papyri.d5.converter.config.LogFormat;
import papyri.d5.converter.config.OutputFormat;
import papyri.d5.converter.corpus.FilterSource;
import picocli.CommandLine;

@CommandLine.Command(name = "papyri-d5", mixinStandardHelpOptions = true,
        description = "Converts EpiDoc papyrus transcriptions into D5 line text")
public class CliArguments {

    @CommandLine.Option(names = "--tm", split = ",", description = "TM number(s) to convert", paramLabel = "TM")
    private List<Integer> tmNumbers = new ArrayList<>();

    @CommandLine.Option(names = "--collection", split = ",", description = "DDB collection name(s) to convert", paramLabel = "NAME")
    private List<String> collections = new ArrayList<>();

    @CommandLine.Option(names = "--title", description = "Filter: substring of the title", paramLabel = "TEXT")
    private String title;

    @CommandLine.Option(names = "--place", description = "Filter: substring of the place of origin", paramLabel = "TEXT")
    private String place;

    @CommandLine.Option(names = "--dclp-hybrid", description = "Filter: substring of the DCLP hybrid identifier", paramLabel = "TEXT")
    private String dclpHybrid;

    @CommandLine.Option(names = "--source", converter = OptionConverters.FilterSources.class, description = "Filter source: dclp, ddb or all")
    private FilterSource source;

    @CommandLine.Option(names = "--require-all-criteria", description = "Filter: every given criterion has to match")
    private boolean requireAllCriteria;

    @CommandLine.Option(names = "--filter-name", description = "Export directory name of a filter run", paramLabel = "NAME")
    private String filterName;

    @CommandLine.Option(names = "--file", description = "Convert a single EpiDoc file and print the result", paramLabel = "PATH")
    private Path file;

    @CommandLine.Option(names = "--data-path", description = "Directory for downloaded data and the TM index", paramLabel = "DIR")
    private Path dataPath;

    @CommandLine.Option(names = "--idp-data-path", description = "Existing idp.data checkout", paramLabel = "DIR")
    private Path idpDataPath;

    @CommandLine.Option(names = "--export-path", description = "Directory results are written to", paramLabel = "DIR")
    private Path exportPath;

    @CommandLine.Option(names = "--format", split = ",", converter = OptionConverters.OutputFormats.class, description = "Output format(s): json, txt")
    private List<OutputFormat> outputFormats = new ArrayList<>();

    @CommandLine.Option(names = "--ignore-formatting-issues", description = "Write results even if validation reported problems")
    private boolean ignoreFormattingIssues;

    @CommandLine.Option(names = "--debug", description = "Verbose logging, single worker, record unimplemented markup")
    private boolean debug;

    @CommandLine.Option(names = "--threads", description = "Number of worker threads", paramLabel = "COUNT")
    private Integer threads;

    @CommandLine.Option(names = "--update", description = "Download the corpus even if a copy exists")
    private boolean update;

    @CommandLine.Option(names = "--reindex", description = "Rebuild the TM index")
    private boolean reindex;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = OptionConverters.LogFormats.class)
    private LogFormat logFormat;

    public List<Integer> tmNumbers() {
        return tmNumbers;
    }

    public List<String> collections() {
        return collections;
    }

    public String title() {
        return title;
    }

    public String place() {
        return place;
    }

    public String dclpHybrid() {
        return dclpHybrid;
    }

    public FilterSource source() {
        return source;
    }

    public boolean requireAllCriteria() {
        return requireAllCriteria;
    }

    public String filterName() {
        return filterName;
    }

    public Path file() {
        return file;
    }

    public Path dataPath() {
        return dataPath;
    }

    public Path idpDataPath() {
        return idpDataPath;
    }

    public Path exportPath() {
        return exportPath;
    }

    public List<OutputFormat> outputFormats() {
        return outputFormats;
    }

    public boolean ignoreFormattingIssues() {
        return ignoreFormattingIssues;
    }

    public boolean debug() {
        return debug;
    }

    public Integer threads() {
        return threads;
    }

    public boolean update() {
        return update;
    }

    public boolean reindex() {
        return reindex;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
