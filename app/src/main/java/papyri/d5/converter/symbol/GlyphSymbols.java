package papyri.d5.converter.symbol;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unicode renderings of {@code <g type="...">} glyphs.
 */
public final class GlyphSymbols {

    private static final Map<String, String> TABLE = buildTable();

    private GlyphSymbols() {
    }

    /**
     * @return the rendering for the glyph type, or an empty string for unknown or missing types
     */
    public static String symbolFor(String type) {
        if (type == null) {
            return "";
        }
        return TABLE.getOrDefault(type, "");
    }

    public static Collection<String> symbols() {
        return TABLE.values();
    }

    private static Map<String, String> buildTable() {
        Map<String, String> table = new LinkedHashMap<>();
        table.put("anti-sigma", "\u037B");
        table.put("antisigma", "\u037B");
        table.put("antisigma-periestigmene", "\u037D");
        table.put("apostrophe", "'");
        table.put("asteriskos", "*");
        table.put("backslash", "\uFE68");
        table.put("backtick", "\u2E0C");
        table.put("brevis", "\u02D8");
        table.put("center-brace-closing", "\u23AC");
        table.put("check", "\u2044");
        table.put("chi-periestigmenon", "\u00B7\u03A7\u00B7");
        table.put("chirho", "\u2627");
        table.put("coronis", "\u2E0E");
        table.put("coronis-lower-half", "\uDB80\uDE24");
        table.put("cross", "\u271D");
        table.put("dagger", "\u2020");
        table.put("dash", "\u2012");
        table.put("dicolon", ":");
        table.put("di-punctus", "\u205A");
        table.put("diastole", "\u02BC");
        table.put("diple", "\uFE65");
        table.put("diple-obelismene", "\u291A");
        table.put("diple-periestigmene", "\u2E16");
        table.put("dipunct", "\u205A");
        table.put("dot", "\u2E31");
        table.put("dotted-obelos", "\u2E13");
        table.put("double-horizontal-bar", "\u0305\u0332");
        table.put("double-slanting-stroke", "//");
        table.put("double-vertical-bar", "\u2016");
        table.put("downwards-ancora", "\u2E15");
        table.put("filled-circle", "\u29BF");
        table.put("filler", "\u07DF");
        table.put("hedera", "\u2766");
        table.put("high-puctus", "\u0387");
        table.put("high-punctus", "\u0387");
        table.put("high-puncuts", "\u0387");
        table.put("hight-punctus", "\u0387");
        table.put("hyphen", "\u2010");
        table.put("hypodiastole", "\u2E12");
        table.put("long-vertical-bar", "|");
        table.put("low-punctus", "\uFE52");
        table.put("lower-brace-closing", "\u23AD");
        table.put("lower-brace-opening", "\u23A9");
        table.put("middot", "\u00B7");
        table.put("middod", "\u00B7");
        table.put("obelos", "\u2015");
        table.put("obelos-periestigmenos", "\u2E13");
        table.put("parens-deletion-closing", "\u23AC");
        table.put("parens-deletion-opening", "\u23A8");
        table.put("parens-lower-closing", "\u23A0");
        table.put("parens-lower-opening", "\u239D");
        table.put("parens-middle-closing", "\u239F");
        table.put("parens-middle-opening", "\u239C");
        table.put("parens-upper-closing", "\u239E");
        table.put("parens-upper-opening", "\u239B");
        table.put("parens-punctuation-closing", "\u23AC");
        table.put("parens-punctuation-opening", "\u23A8");
        table.put("parent-punctuation-opening", "\u23A8");
        table.put("percent", "%");
        table.put("reverse-dotted-obelos", "\u00B7\\\u00B7");
        table.put("rho-cross", "\u2CE8");
        table.put("s-etous", "\uD800\uDD79");
        table.put("short-vertical-bar", "\uE197");
        table.put("sinusoid-stroke", "\uE0E7");
        table.put("slanting-stroke", "/");
        table.put("slashed-N", "\u203E");
        table.put("stauros", "\u2020");
        table.put("swungdash", "~");
        table.put("tetrapunct", "\u2058");
        table.put("tilde", "~");
        table.put("tripunct", "\u22EE");
        table.put("upper-brace-closing", "\u23AB");
        table.put("upper-brace-opening", "\u23A7");
        table.put("upward-pointing-arrowhead", "\u2197");
        table.put("upwards-ancora", "\u2E15");
        table.put("x", "N");
        table.put("xs", "NNN");
        return Map.copyOf(table);
    }
}
