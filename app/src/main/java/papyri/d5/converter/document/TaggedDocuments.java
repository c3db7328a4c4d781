package papyri.d5.converter.document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;

/**
 * Parses EpiDoc XML into {@link TaggedNode} trees.
 */
public final class TaggedDocuments {

    private TaggedDocuments() {
    }

    public static TaggedNode parse(String xml) {
        Document document = Jsoup.parse(xml == null ? "" : xml, "", Parser.xmlParser());
        return JsoupTaggedNode.wrap(document);
    }

    /**
     * @throws IOException if the file cannot be read
     */
    public static TaggedNode read(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }
}
