package papyri.d5.converter.corpus;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import papyri.d5.converter.document.TaggedDocuments;
import papyri.d5.converter.document.TaggedNode;

/**
 * Catalogue data read from the {@code teiHeader} of an EpiDoc file.
 */
record EpiDocHeader(Set<Integer> tmNumbers, Optional<String> title, Optional<String> origPlace,
        Optional<String> dclpHybrid) {

    private static final Logger LOGGER = LoggerFactory.getLogger(EpiDocHeader.class);

    EpiDocHeader {
        tmNumbers = Set.copyOf(tmNumbers);
    }

    static EpiDocHeader read(Path file) throws IOException {
        return of(TaggedDocuments.read(file), file.toString());
    }

    static EpiDocHeader of(TaggedNode root, String source) {
        Set<Integer> tmNumbers = new LinkedHashSet<>();
        root.descendants()
                .filter(node -> node.is("idno") && node.attribute("type").filter("TM"::equals).isPresent())
                .flatMap(node -> Arrays.stream(node.text().trim().split("\\s+")))
                .filter(value -> !value.isEmpty())
                .forEach(value -> {
                    try {
                        tmNumbers.add(Integer.parseInt(value));
                    } catch (NumberFormatException ex) {
                        LOGGER.warn("Ignoring malformed TM number '{}' in {}", value, source);
                    }
                });
        return new EpiDocHeader(tmNumbers,
                firstText(root, node -> node.is("title") && node.closestAncestor("titleStmt").isPresent()),
                firstText(root, node -> node.is("origPlace") && node.closestAncestor("origin").isPresent()),
                firstText(root, node -> node.is("idno")
                        && node.attribute("type").filter("dclp-hybrid"::equals).isPresent()
                        && node.closestAncestor("publicationStmt").isPresent()));
    }

    private static Optional<String> firstText(TaggedNode root, Predicate<TaggedNode> selector) {
        return root.descendants()
                .filter(selector)
                .findFirst()
                .map(node -> node.text().strip())
                .filter(text -> !text.isEmpty());
    }
}
