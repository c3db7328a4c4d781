package papyri.d5.converter.corpus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

final class EpiDocFixtures {

    private EpiDocFixtures() {
    }

    static Path write(Path file, String tmNumbers, String title, String place, String dclpHybrid) throws IOException {
        Files.createDirectories(file.getParent());
        String hybrid = dclpHybrid == null ? "" : "<idno type=\"dclp-hybrid\">" + dclpHybrid + "</idno>";
        Files.writeString(file, "<TEI xmlns=\"http://www.tei-c.org/ns/1.0\"><teiHeader><fileDesc>"
                + "<titleStmt><title>" + title + "</title></titleStmt>"
                + "<publicationStmt><idno type=\"filename\">" + file.getFileName() + "</idno>"
                + "<idno type=\"TM\">" + tmNumbers + "</idno>" + hybrid + "</publicationStmt>"
                + "<sourceDesc><msDesc><history><origin><origPlace>" + place + "</origPlace></origin></history>"
                + "</msDesc></sourceDesc></fileDesc></teiHeader>"
                + "<text><body><div type=\"edition\" xml:lang=\"grc\"><div n=\"r\" subtype=\"recto\">"
                + "<ab><lb n=\"1\"/>καὶ</ab></div></div></body></text></TEI>");
        return file;
    }
}
