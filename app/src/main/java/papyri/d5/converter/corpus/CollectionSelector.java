package papyri.d5.converter.corpus;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves DDB collection names (the directories of {@code DDB_EpiDoc_XML}) to the TM numbers they contain.
 */
public class CollectionSelector {

    private static final Logger LOGGER = LoggerFactory.getLogger(CollectionSelector.class);

    private final CorpusLayout layout;

    public CollectionSelector(CorpusLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    public List<String> collections() {
        Path ddb = layout.ddbDirectory();
        if (!Files.isDirectory(ddb)) {
            throw new CorpusException("Could not find " + ddb);
        }
        try (Stream<Path> children = Files.list(ddb)) {
            return children.filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list collections in " + ddb, ex);
        }
    }

    /**
     * Collects the TM numbers of all files of the named collections. Names are matched case-insensitively.
     *
     * @throws CorpusException if a single collection was requested and it does not exist
     */
    public List<Integer> tmNumbers(Collection<String> names) {
        List<String> known = collections();
        List<Path> files = new ArrayList<>();
        for (String name : names) {
            String collection = name.toLowerCase(Locale.ROOT);
            if (!known.contains(collection)) {
                if (names.size() == 1) {
                    throw new CorpusException("Collection " + name + " not found");
                }
                LOGGER.error("Collection {} not found", name);
                continue;
            }
            files.addAll(XmlFiles.under(layout.ddbDirectory().resolve(collection)));
        }
        return TmIndex.entriesOf(files).stream()
                .map(TmIndexEntry::tm)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }
}
