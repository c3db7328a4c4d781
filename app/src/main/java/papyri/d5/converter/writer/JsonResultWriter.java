package papyri.d5.converter.writer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import papyri.d5.converter.convert.ConversionResult;
import papyri.d5.converter.convert.TextBlock;

/**
 * Writes {@code <tm>_<source>.json} holding the text blocks with their division number and subtype.
 */
public class JsonResultWriter implements ResultWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path directory;

    public JsonResultWriter(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public Path write(int tm, String sourceName, ConversionResult result) {
        Path target = directory.resolve(tm + "_" + sourceName + ".json");
        try {
            Files.createDirectories(directory);
            MAPPER.writeValue(target.toFile(), toJson(result));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write converted document: " + target, ex);
        }
        return target;
    }

    static ObjectNode toJson(ConversionResult result) {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode blocks = root.putArray("text_blocks");
        for (TextBlock block : result.blocks()) {
            ObjectNode node = blocks.addObject();
            node.put("n", block.n());
            node.put("subtype", block.subtype());
            ArrayNode text = node.putArray("text");
            block.lines().forEach(text::add);
        }
        return root;
    }
}
