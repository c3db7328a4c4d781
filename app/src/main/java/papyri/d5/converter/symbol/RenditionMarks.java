package papyri.d5.converter.symbol;

import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Combining marks applied by {@code <hi rend="...">}.
 *
 * <p>Accent-like renditions append a single mark to the text. Line renditions (underline, supraline) mark
 * every character of the text.
 */
public final class RenditionMarks {

    /** Mark appended to every character of damaged but legible ({@code unclear}) text. */
    public static final String UNCLEAR = "\u0323";

    private static final String UNDERLINE = "\u0332";
    private static final String SUPRALINE = "\u0305";

    private static final Map<String, UnaryOperator<String>> TABLE = Map.ofEntries(
            Map.entry("diaeresis", text -> text + "\u0308"),
            Map.entry("asper", text -> text + "\u0314"),
            Map.entry("acute", text -> text + "\u0301"),
            Map.entry("circumflex", text -> text + "\u0342"),
            Map.entry("grave", text -> text + "\u0300"),
            Map.entry("lenis", text -> text + "\u0313"),
            Map.entry("overdot", text -> text + "\u0307"),
            Map.entry("underlined", text -> markEachCharacter(text, UNDERLINE)),
            Map.entry("underline", text -> markEachCharacter(text, UNDERLINE)),
            Map.entry("supraline", text -> markEachCharacter(text, SUPRALINE)),
            Map.entry("supraline-underline", text -> markEachCharacter(text, SUPRALINE + UNDERLINE)));

    private static final Set<String> MARKS = Set.of(
            "\u0308", "\u0314", "\u0301", "\u0342", "\u0300", "\u0313", "\u0307", UNDERLINE, SUPRALINE);

    private RenditionMarks() {
    }

    /**
     * Applies the rendition to the text; unknown or missing renditions leave it unchanged.
     */
    public static String apply(String rend, String text) {
        if (rend == null) {
            return text;
        }
        return TABLE.getOrDefault(rend, UnaryOperator.identity()).apply(text);
    }

    public static String markEachCharacter(String text, String mark) {
        StringBuilder marked = new StringBuilder(text.length() * (1 + mark.length()));
        text.codePoints().forEach(codePoint -> marked.appendCodePoint(codePoint).append(mark));
        return marked.toString();
    }

    public static Set<String> marks() {
        return MARKS;
    }
}
