package papyri.d5.converter.config;

import java.util.Locale;

/**
 * File formats conversion results are written in.
 */
public enum OutputFormat {
    JSON,
    TXT;

    public static OutputFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Output format must be provided");
        }
        return OutputFormat.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    public String directoryName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
