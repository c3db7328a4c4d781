package papyri.d5.converter.writer;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import papyri.d5.converter.config.OutputFormat;
import papyri.d5.converter.convert.ConversionResult;
import papyri.d5.converter.convert.TextBlock;

class ResultWriterTest {

    private static final ConversionResult RESULT = new ConversionResult(
            List.of(new TextBlock("r", "recto", List.of("ΑΒ", "]ΓΔ")), new TextBlock("v", "verso", List.of("Ε"))),
            List.of(), List.of(), new TreeSet<>(Set.of("grc")));

    @TempDir
    Path tempDir;

    @Test
    void writesJsonBlocks() throws Exception {
        Path written = new JsonResultWriter(tempDir.resolve("json")).write(1234, "p.oxy.1.1", RESULT);

        assertThat(written).isEqualTo(tempDir.resolve("json").resolve("1234_p.oxy.1.1.json"));
        JsonNode root = new ObjectMapper().readTree(written.toFile());
        assertThat(root.get("text_blocks")).hasSize(2);
        JsonNode first = root.get("text_blocks").get(0);
        assertThat(first.get("n").asText()).isEqualTo("r");
        assertThat(first.get("subtype").asText()).isEqualTo("recto");
        assertThat(first.get("text").get(1).asText()).isEqualTo("]ΓΔ");
    }

    @Test
    void writesTextWithoutTrailingNewline() throws Exception {
        Path written = new TextResultWriter(tempDir.resolve("txt")).write(1234, "p.oxy.1.1", RESULT);

        assertThat(Files.readString(written)).isEqualTo("ΑΒ\n]ΓΔ\nΕ");
    }

    @Test
    void overwritesEarlierOutput() throws Exception {
        TextResultWriter writer = new TextResultWriter(tempDir);
        Files.writeString(tempDir.resolve("1_a.txt"), "a much longer earlier export");

        writer.write(1, "a", RESULT);

        assertThat(Files.readString(tempDir.resolve("1_a.txt"))).isEqualTo("ΑΒ\n]ΓΔ\nΕ");
    }

    @Test
    void createsOneWriterPerFormat() {
        List<ResultWriter> writers = ResultWriter.forFormats(EnumSet.allOf(OutputFormat.class), tempDir);

        assertThat(writers).hasSize(2);
        assertThat(writers.get(0)).isInstanceOf(JsonResultWriter.class);
        assertThat(writers.get(1)).isInstanceOf(TextResultWriter.class);
        assertThat(ResultWriter.forFormats(Set.of(OutputFormat.TXT), tempDir)).singleElement()
                .isInstanceOf(TextResultWriter.class);
    }
}
