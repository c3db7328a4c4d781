package papyri.d5.converter.convert;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import papyri.d5.converter.document.TaggedDocuments;
import papyri.d5.converter.document.TaggedNode;
import papyri.d5.converter.format.FormatterState;
import papyri.d5.converter.format.LineFormatter;
import papyri.d5.converter.format.LineValidator;
import papyri.d5.converter.insert.InsertionResolver;
import papyri.d5.converter.transform.RawLine;
import papyri.d5.converter.transform.Rendering;
import papyri.d5.converter.transform.TagTransformer;

/**
 * Converts EpiDoc documents into validated D5 text blocks. Stateless apart from the shared transformer; every
 * conversion gets a fresh {@link FormatterState}.
 */
public class D5Converter {

    private static final Logger LOGGER = LoggerFactory.getLogger(D5Converter.class);

    private static final String LANGUAGE_ATTRIBUTE = "xml:lang";
    private static final String ADMINISTRATIVE_LANGUAGE = "en";

    private final TagTransformer transformer;

    public D5Converter() {
        this(new TagTransformer());
    }

    public D5Converter(TagTransformer transformer) {
        this.transformer = Objects.requireNonNull(transformer, "transformer");
    }

    public ConversionResult convert(Path file) {
        TaggedNode root;
        try {
            root = TaggedDocuments.read(file);
        } catch (IOException ex) {
            throw new ConversionException("Could not read " + file + ": " + ex.getMessage(), ex);
        }
        LOGGER.debug("Converting {}", file);
        return convert(root);
    }

    public ConversionResult convertMarkup(String xml) {
        return convert(TaggedDocuments.parse(xml));
    }

    public ConversionResult convert(TaggedNode root) {
        FormatterState state = new FormatterState(languagesOf(root));
        LOGGER.debug("Found languages {}", state.languages());
        List<TextBlock> blocks = new ArrayList<>();
        List<TaggedNode> textParts = root.descendants()
                .filter(node -> node.is("ab"))
                .collect(Collectors.toList());
        for (TaggedNode ab : textParts) {
            Optional<Rendering> rendering = transformer.transformBlock(ab);
            if (rendering.isEmpty()) {
                continue;
            }
            List<String> lines = validatedLines(rendering.get(), state);
            if (lines.isEmpty()) {
                continue;
            }
            Optional<TaggedNode> div = ab.closestAncestor("div");
            blocks.add(new TextBlock(
                    div.flatMap(node -> node.attribute("n")).orElse(""),
                    div.flatMap(node -> node.attribute("subtype")).orElse(""),
                    lines));
        }
        return new ConversionResult(blocks, state.errorLog(), state.changes(), state.languages());
    }

    private List<String> validatedLines(Rendering rendering, FormatterState state) {
        List<RawLine> rawLines = rendering.lines().stream()
                .filter(line -> !line.isBlank())
                .collect(Collectors.toList());
        List<String> lines = new ArrayList<>();
        for (String line : InsertionResolver.resolve(rawLines)) {
            String formatted = LineFormatter.formatLine(line);
            if (formatted.isEmpty()) {
                continue;
            }
            String validated = LineValidator.validateLine(formatted, state);
            if (!validated.isEmpty()) {
                lines.add(validated);
            }
        }
        return lines;
    }

    private static Set<String> languagesOf(TaggedNode root) {
        return root.descendants()
                .map(node -> node.attribute(LANGUAGE_ATTRIBUTE))
                .flatMap(Optional::stream)
                .filter(language -> !language.equals(ADMINISTRATIVE_LANGUAGE))
                .collect(Collectors.toSet());
    }
}
