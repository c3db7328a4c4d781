package papyri.d5.converter.corpus;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects papyri by catalogue data: title, place of origin and (DCLP only) the dclp-hybrid identifier. Every
 * criterion is a case-insensitive substring match.
 *
 * @param source              the part of the corpus to search
 * @param title               matched against {@code titleStmt/title}, may be {@code null}
 * @param place               matched against {@code origin/origPlace}, may be {@code null}
 * @param dclpHybrid          matched against {@code publicationStmt/idno[@type='dclp-hybrid']}, may be {@code null}
 * @param singleMatchSuffices if false, every given criterion has to match
 * @param name                export directory name; derived from the criteria when blank
 */
public record PapyrusFilter(FilterSource source, String title, String place, String dclpHybrid,
        boolean singleMatchSuffices, String name) {

    private static final Logger LOGGER = LoggerFactory.getLogger(PapyrusFilter.class);

    public PapyrusFilter {
        Objects.requireNonNull(source, "source");
        title = blankToNull(title);
        place = blankToNull(place);
        dclpHybrid = source == FilterSource.DDB ? null : blankToNull(dclpHybrid);
        if (title == null && place == null && dclpHybrid == null) {
            throw new IllegalArgumentException("title, place, or dclp-hybrid must be set");
        }
        if (name == null || name.isBlank()) {
            name = "filter-" + source.label() + "-" + title + "-" + place + "-" + dclpHybrid + "-"
                    + singleMatchSuffices;
        }
    }

    /**
     * @return the distinct TM numbers of all matching files, sorted
     */
    public List<Integer> select(CorpusLayout layout) {
        List<Integer> tmNumbers = new ArrayList<>();
        List<Path> files = files(layout);
        LOGGER.info("Filtering {} files with {}", files.size(), name);
        for (Path file : files) {
            try {
                EpiDocHeader header = EpiDocHeader.read(file);
                if (matches(header, file.startsWith(layout.dclpDirectory()))) {
                    tmNumbers.addAll(header.tmNumbers());
                }
            } catch (IOException ex) {
                LOGGER.warn("Skipping unreadable file {}: {}", file, ex.getMessage());
            }
        }
        return tmNumbers.stream().distinct().sorted().collect(Collectors.toList());
    }

    boolean matches(EpiDocHeader header, boolean dclpFile) {
        List<Boolean> results = new ArrayList<>();
        if (title != null) {
            results.add(contains(header.title(), title));
        }
        if (place != null) {
            results.add(contains(header.origPlace(), place));
        }
        if (dclpHybrid != null) {
            results.add(dclpFile && contains(header.dclpHybrid(), dclpHybrid));
        }
        return singleMatchSuffices
                ? results.contains(Boolean.TRUE)
                : !results.contains(Boolean.FALSE);
    }

    private List<Path> files(CorpusLayout layout) {
        return switch (source) {
            case DCLP -> XmlFiles.under(layout.dclpDirectory());
            case DDB -> XmlFiles.under(layout.ddbDirectory());
            case ALL -> XmlFiles.under(layout.idpDataPath());
        };
    }

    private static boolean contains(Optional<String> value, String criterion) {
        return value.map(text -> text.toLowerCase(Locale.ROOT).contains(criterion.toLowerCase(Locale.ROOT)))
                .orElse(false);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
