package papyri.d5.converter.transform;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import papyri.d5.converter.document.TaggedDocuments;
import papyri.d5.converter.document.TaggedNode;

class TagTransformerTest {

    @TempDir
    Path tempDir;

    @Test
    void blockWithoutLineBreakRendersNothing() {
        TagTransformer transformer = new TagTransformer();

        assertThat(transformer.transformBlock(block("<ab>αβγ</ab>"))).isEmpty();
    }

    @Test
    void ignoresTextBeforeTheFirstLineBreak() {
        TagTransformer transformer = new TagTransformer();

        Rendering rendering = transformer.transformBlock(block("<ab>ignored<lb n=\"1\"/>αβ<lb n=\"2\"/>γ</ab>"))
                .orElseThrow();

        assertThat(rendering.lines()).extracting(RawLine::text).containsExactly("ΑΒ", "Γ");
    }

    @Test
    void recordsUnknownMilestones() {
        List<String> recorded = new ArrayList<>();
        TagTransformer transformer = new TagTransformer(recorded::add);

        Rendering rendering = transformer
                .transformBlock(block("<ab><lb n=\"1\"/>α<milestone rend=\"box\" unit=\"undefined\"/>β</ab>"))
                .orElseThrow();

        assertThat(rendering.plainText()).isEqualTo("ΑΒ");
        assertThat(recorded).containsExactly("milestone rend=\"box\"");
    }

    @Test
    void numberWithTickKeepsTheTick() {
        TagTransformer transformer = new TagTransformer();

        Rendering rendering = transformer
                .transformBlock(block("<ab><lb n=\"1\"/><num value=\"3\" tick=\"1\">γ</num></ab>"))
                .orElseThrow();

        assertThat(rendering.plainText()).isEqualTo("Γ'");
    }

    @Test
    void fileRecorderWritesEachDescriptionOnce() throws Exception {
        Path file = tempDir.resolve("dev").resolve("not_yet_implemented.txt");
        FileUnimplementedMarkupRecorder recorder = new FileUnimplementedMarkupRecorder(file);

        recorder.record("milestone rend=\"box\"");
        recorder.record("milestone rend=\"box\"");
        recorder.record("milestone rend=\"stroke\"");

        assertThat(Files.readAllLines(file)).containsExactly("milestone rend=\"box\"", "milestone rend=\"stroke\"");

        recorder.reset();

        assertThat(file).doesNotExist();
    }

    private static TaggedNode block(String xml) {
        return TaggedDocuments.parse(xml).descendants()
                .filter(node -> node.is("ab"))
                .findFirst()
                .orElseThrow();
    }
}
