package papyri.d5.converter.cli;

import papyri.d5.converter.config.LogFormat;
import papyri.d5.converter.config.OutputFormat;
import papyri.d5.converter.corpus.FilterSource;
import picocli.CommandLine;

/**
 * Case-insensitive converters for the enum-valued options.
 */
public final class OptionConverters {

    private OptionConverters() {
    }

    public static class LogFormats implements CommandLine.ITypeConverter<LogFormat> {
        @Override
        public LogFormat convert(String value) {
            return LogFormat.from(value);
        }
    }

    public static class OutputFormats implements CommandLine.ITypeConverter<OutputFormat> {
        @Override
        public OutputFormat convert(String value) {
            return OutputFormat.from(value);
        }
    }

    public static class FilterSources implements CommandLine.ITypeConverter<FilterSource> {
        @Override
        public FilterSource convert(String value) {
            return FilterSource.from(value);
        }
    }
}
