package papyri.d5.converter.corpus;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps TM numbers to the EpiDoc files describing them. Built by scanning the corpus once and persisted as JSON.
 */
public final class TmIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(TmIndex.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<TmIndexEntry>> ENTRIES = new TypeReference<>() {
    };

    private final List<TmIndexEntry> entries;
    private final Map<Integer, List<Path>> pathsByTm;

    public TmIndex(Collection<TmIndexEntry> entries) {
        this.entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
        this.pathsByTm = this.entries.stream()
                .collect(Collectors.groupingBy(TmIndexEntry::tm,
                        Collectors.collectingAndThen(
                                Collectors.mapping(entry -> Paths.get(entry.path()), Collectors.toList()),
                                paths -> paths.stream().distinct().sorted().collect(Collectors.toUnmodifiableList()))));
    }

    /**
     * Loads the persisted index, building and saving it first if it is missing or {@code rebuild} is set.
     */
    public static TmIndex loadOrBuild(CorpusLayout layout, boolean rebuild) {
        if (rebuild || !Files.exists(layout.tmIndexPath())) {
            TmIndex index = build(layout);
            index.save(layout.tmIndexPath());
            return index;
        }
        return load(layout.tmIndexPath());
    }

    /**
     * Scans {@code DCLP} and {@code DDB_EpiDoc_XML} for TM numbers.
     *
     * @throws CorpusException if neither directory holds any XML file
     */
    public static TmIndex build(CorpusLayout layout) {
        LOGGER.info("Indexing TM numbers under {}", layout.idpDataPath());
        List<Path> files = new ArrayList<>();
        for (Path directory : List.of(layout.dclpDirectory(), layout.ddbDirectory())) {
            if (Files.isDirectory(directory)) {
                files.addAll(XmlFiles.under(directory));
            } else {
                LOGGER.error("Could not find {}", directory);
            }
        }
        if (files.isEmpty()) {
            throw new CorpusException("Indexing failed: No XML files found; " + layout.idpDataPath()
                    + " must contain a copy of DCLP and DDB_EpiDoc_XML from https://github.com/papyri/idp.data");
        }
        TmIndex index = new TmIndex(entriesOf(files));
        LOGGER.info("Indexed {} TM numbers in {} files", index.tmNumbers().size(), files.size());
        return index;
    }

    /**
     * Reads the TM numbers of the given files. Unreadable files are logged and skipped.
     */
    public static List<TmIndexEntry> entriesOf(Collection<Path> files) {
        List<TmIndexEntry> entries = new ArrayList<>();
        for (Path file : files) {
            try {
                EpiDocHeader header = EpiDocHeader.read(file);
                header.tmNumbers().stream()
                        .sorted()
                        .map(tm -> new TmIndexEntry(tm, file.toString()))
                        .forEach(entries::add);
            } catch (IOException ex) {
                LOGGER.warn("Skipping unreadable file {}: {}", file, ex.getMessage());
            }
        }
        return entries;
    }

    public static TmIndex load(Path file) {
        try {
            return new TmIndex(MAPPER.readValue(file.toFile(), ENTRIES));
        } catch (IOException ex) {
            throw new CorpusException("Failed to read TM index " + file, ex);
        }
    }

    public void save(Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(file.toFile(), entries);
        } catch (IOException ex) {
            throw new CorpusException("Failed to write TM index " + file, ex);
        }
    }

    /**
     * @return the distinct files of {@code tm}, sorted; empty if the TM number is unknown
     */
    public List<Path> pathsFor(int tm) {
        return pathsByTm.getOrDefault(tm, List.of());
    }

    public List<Integer> tmNumbers() {
        return pathsByTm.keySet().stream()
                .sorted(Comparator.naturalOrder())
                .collect(Collectors.toUnmodifiableList());
    }

    public List<TmIndexEntry> entries() {
        return entries;
    }
}
