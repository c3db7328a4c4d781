package papyri.d5.converter.batch;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import papyri.d5.converter.convert.D5Converter;
import papyri.d5.converter.corpus.TmIndex;
import papyri.d5.converter.corpus.TmIndexEntry;
import papyri.d5.converter.writer.ResultWriter;

class DocumentProcessorTest {

    @TempDir
    Path tempDir;

    private final List<String> writes = new ArrayList<>();

    private final ResultWriter recordingWriter = (tm, sourceName, result) -> {
        writes.add(tm + ":" + sourceName + ":" + result.lines());
        return tempDir.resolve(tm + "_" + sourceName);
    };

    @Test
    void writesEveryFileOfTheTmNumber() throws IOException {
        Path first = document("bgu.1.1.xml", "αβ");
        Path second = document("bgu.1.2.xml", "γδ");
        DocumentProcessor processor = processor(index(7, first, second), false);

        ProcessingOutcome outcome = processor.process(7);

        assertThat(outcome.status()).isEqualTo(ProcessingOutcome.Status.WRITTEN);
        assertThat(outcome.writtenFiles()).hasSize(2);
        assertThat(writes).containsExactly("7:bgu.1.1:[ΑΒ]", "7:bgu.1.2:[ΓΔ]");
    }

    @Test
    void skipsUnknownTmNumbers() {
        ProcessingOutcome outcome = processor(new TmIndex(List.of()), false).process(42);

        assertThat(outcome.isSkipped()).isTrue();
        assertThat(outcome.message()).isEqualTo("Could not find any XML file(s) associated with TM number 42.");
    }

    @Test
    void skipsDocumentsWithFormattingErrors() throws IOException {
        Path broken = document("broken.xml", "α9");

        ProcessingOutcome outcome = processor(index(3, broken), false).process(3);

        assertThat(outcome.isSkipped()).isTrue();
        assertThat(outcome.message()).startsWith("TM 3 skipped due to formatting errors: [Forbidden character(s) [9]");
        assertThat(writes).isEmpty();
    }

    @Test
    void writesDocumentsWithFormattingErrorsWhenIgnored() throws IOException {
        Path broken = document("broken.xml", "α9");

        ProcessingOutcome outcome = processor(index(3, broken), true).process(3);

        assertThat(outcome.status()).isEqualTo(ProcessingOutcome.Status.WRITTEN);
        assertThat(writes).containsExactly("3:broken:[Α9]");
    }

    @Test
    void reportsNothingToWriteForEmptyDocuments() throws IOException {
        Path empty = tempDir.resolve("empty.xml");
        Files.writeString(empty, "<TEI><ab>no line breaks</ab></TEI>");

        ProcessingOutcome outcome = processor(index(5, empty), false).process(5);

        assertThat(outcome.status()).isEqualTo(ProcessingOutcome.Status.NOTHING_TO_WRITE);
        assertThat(writes).isEmpty();
    }

    @Test
    void skipsUnreadableFiles() {
        ProcessingOutcome outcome = processor(index(9, tempDir.resolve("gone.xml")), false).process(9);

        assertThat(outcome.isSkipped()).isTrue();
        assertThat(outcome.message()).startsWith("Could not read");
    }

    private DocumentProcessor processor(TmIndex index, boolean ignoreFormattingIssues) {
        return new DocumentProcessor(index, new D5Converter(), List.of(recordingWriter), ignoreFormattingIssues);
    }

    private static TmIndex index(int tm, Path... files) {
        List<TmIndexEntry> entries = new ArrayList<>();
        for (Path file : files) {
            entries.add(new TmIndexEntry(tm, file.toString()));
        }
        return new TmIndex(entries);
    }

    private Path document(String name, String text) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, "<TEI><div xml:lang=\"grc\" n=\"1\" subtype=\"column\"><ab><lb n=\"1\"/>" + text
                + "</ab></div></TEI>");
        return file;
    }
}
