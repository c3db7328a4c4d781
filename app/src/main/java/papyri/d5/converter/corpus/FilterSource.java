package papyri.d5.converter.corpus;

import java.util.Locale;

/**
 * Part of the corpus a {@link PapyrusFilter} searches.
 */
public enum FilterSource {
    DCLP,
    DDB,
    ALL;

    public static FilterSource from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Filter source must be provided");
        }
        return FilterSource.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
