package papyri.d5.converter.symbol;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Symbols standing in for abbreviated words, keyed by the first five normalized letters of the expansion.
 */
public final class AbbreviationSymbols {

    /** Generic abbreviation sign used when an expansion has no dedicated symbol. */
    public static final String GENERIC = "\u2105";

    static final int KEY_LENGTH = 5;

    private static final Map<String, String> TABLE = buildTable();

    private AbbreviationSymbols() {
    }

    /**
     * Looks up the symbol for a normalized expansion such as {@code ΕΤΟΥΣ}.
     *
     * @param expansion normalized text of the {@code ex} element
     * @return the dedicated symbol, or {@link #GENERIC} if there is none
     */
    public static String symbolFor(String expansion) {
        if (expansion == null || expansion.isEmpty()) {
            return GENERIC;
        }
        String key = expansion;
        if (expansion.codePointCount(0, expansion.length()) > KEY_LENGTH) {
            key = expansion.substring(0, expansion.offsetByCodePoints(0, KEY_LENGTH));
        }
        return TABLE.getOrDefault(key, GENERIC);
    }

    public static Collection<String> symbols() {
        return TABLE.values();
    }

    private static Map<String, String> buildTable() {
        Map<String, String> table = new LinkedHashMap<>();
        // year
        table.put("ΕΤΟΥΣ", "\uD800\uDD79");
        table.put("ΕΤΟΣ", "\uD800\uDD79");
        table.put("ΕΤΩΝ", "\uD800\uDD79");
        table.put("ΕΤΕΣΙ", "\uD800\uDD79");
        // measures
        table.put("ΑΡΟΥΡ", "\uD800\uDD87");
        table.put("ΑΡΤΑΒ", "\uD800\uDD86");
        table.put("ΧΟΙΝΙ", "\uE674");
        table.put("ΞΕΣΤΗ", "\uD800\uDD85");
        table.put("ΞΕΣΤΟ", "\uD800\uDD85");
        table.put("ΞΕΣΤΩ", "\uD800\uDD85");
        table.put("ΛΙΤΡΑ", "\uD800\uDD83");
        table.put("ΛΙΤΡΩ", "\uD800\uDD83");
        table.put("ΟΥΓΚΙ", "\uD800\uDD84");
        table.put("ΜΕΤΡΕ", "\uE63D");
        table.put("ΜΕΤΡΟ", "\uE63D");
        // numbers and fractions
        table.put("ΤΡΙΤΟ", "\u2C85");
        table.put("ΤΕΤΑΡ", "\uE606");
        // money
        table.put("ΔΡΑΧΜ", "\uD800\uDD7B");
        table.put("ΟΒΟΛΟ", "\uD800\uDD7C");
        table.put("ΔΙΩΒΟ", "\uD800\uDD7D");
        table.put("ΤΡΙΩΒ", "\uD800\uDD7E");
        table.put("ΤΕΤΡΩ", "\uD800\uDD7F");
        table.put("ΠΕΝΤΩ", "\uD800\uDD80");
        table.put("ΗΜΙΩΒ", "\uE675");
        table.put("ΗΜΙΟΒ", "\uE675");
        table.put("ΧΑΛΚΟ", "\u2CAC");
        table.put("ΔΙΧΑΛ", "\u2CAD");
        table.put("ΚΕΡΑΤ", "\uE67D");
        table.put("ΤΑΛΑΝ", "\uD800\uDD7A");
        table.put("ΔΗΝΑΡ", "\uE6A3");
        table.put("ΝΟΜΙΣ", "\uE696");
        table.put("ΜΥΡΙΑ", "\uE616");
        // wheat
        table.put("ΠΥΡΟΥ", "\uE63E");
        table.put("ΠΥΡΩ", "\uE63E");
        table.put("ΠΥΡΩΙ", "\uE63E");
        table.put("ΠΥΡΟΝ", "\uE63E");
        table.put("ΠΥΡΟΣ", "\uE63E");
        // operators
        table.put("ΓΙΝΟΝ", "\uE691");
        table.put("ΓΙΝΕΤ", "\uE691");
        table.put("ΓΙΓΝΟ", "\uE691");
        table.put("ΓΙΓΝΕ", "\uE691");
        table.put("ΛΟΙΠΩ", "\uE613");
        table.put("ΛΟΙΠΟ", "\uE613");
        // fractions
        table.put("ΗΜΙΣΥ", "\uD800\uDD75");
        // monograms
        table.put("ΠΡΟΣ", "\uE688");
        table.put("ΓΡΑΜΜ", "\uE689");
        table.put("ΖΜΥΡΝ", "\uE68A");
        table.put("ΩΡΑ", "\uE68B");
        table.put("ΩΡΑΣ", "\uE68B");
        table.put("ΜΕΡΙΣ", "\uE68C");
        table.put("ΜΕΡΙΔ", "\uE68C");
        table.put("ΧΕΙΡΙ", "\uE68E");
        table.put("ΧΡΩ", "\u2CE9");
        // other symbols
        table.put("ΑΥΤΟΣ", "\uE632");
        table.put("ΑΥΤΟΥ", "\uE632");
        table.put("ΑΥΤΩ", "\uE632");
        table.put("ΑΥΤΩΙ", "\uE632");
        table.put("ΑΥΤΟΝ", "\uE632");
        table.put("ΑΥΤΟΙ", "\uE632");
        table.put("ΑΥΤΩΝ", "\uE632");
        table.put("ΑΥΤΗ", "\uE632");
        table.put("ΑΥΤΗΣ", "\uE632");
        table.put("ΑΥΤΗΙ", "\uE632");
        table.put("ΑΥΤΗΝ", "\uE632");
        table.put("ΑΥΤΑΙ", "\uE632");
        table.put("ΑΥΤΑΣ", "\uE632");
        table.put("ΧΑΙΡΕ", "\uE687");
        table.put("ΥΠΕΡ", "\uE67A");
        table.put("ΟΜΟΥ", "\uE670");
        table.put("ΙΝΔΙΚ", "\uE698");
        // additional symbols
        table.put("ΔΙΜΟΙ", "\uE698");
        return Map.copyOf(table);
    }
}
