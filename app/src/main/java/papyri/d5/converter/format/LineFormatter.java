package papyri.d5.converter.format;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import papyri.d5.converter.symbol.AbbreviationSymbols;

/**
 * Normalizes the gap and restoration notation of a single output line.
 *
 * <p>Gaps touching the start or end of a line collapse into a lone {@code ]} or {@code [}, adjacent
 * bracketed gaps inside the line are merged, and lines that hold nothing but unreadable gaps are dropped.
 */
public final class LineFormatter {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineFormatter.class);

    private static final String POP_DIRECTIONAL_ISOLATE = "\u2069";
    private static final String EMPTY_BRACKETS = "[]";

    private static final Pattern LEADING_VACAT = Pattern.compile("^(?:\\? )+");
    private static final Pattern TRAILING_VACAT = Pattern.compile("(?: \\?)+$");
    private static final Pattern GAP_CHARACTERS_ONLY = Pattern.compile("[\\[\\]\\-?]+");
    private static final Pattern BRACKETED_DASHES = Pattern.compile("\\[-+\\]");
    private static final Pattern LEADING_GAPS = Pattern.compile("^(?:\\[-+\\]|\\[\\?\\])+");
    private static final Pattern TRAILING_GAPS = Pattern.compile("(?:\\[-+\\]|\\[\\?\\])+$");
    private static final Pattern ADJACENT_DASH_GROUPS = Pattern.compile("(?:\\[-+\\]){2,}");
    private static final Pattern UNKNOWN_WITH_DASH_GROUPS = Pattern.compile("(\\[-+\\])*\\[\\?\\](\\[-+\\])*");
    private static final Pattern REPEATED_UNKNOWN = Pattern.compile("(?:\\[\\?\\]){2,}");
    private static final Pattern REPEATED_GENERIC_ABBREVIATION =
            Pattern.compile(Pattern.quote(AbbreviationSymbols.GENERIC) + "+");

    private LineFormatter() {
    }

    /**
     * Formats a line until it no longer changes, so formatting an already formatted line is a no-op.
     *
     * @return the formatted line, empty if the line carries no information
     */
    public static String formatLine(String line) {
        String current = line;
        String next = formatOnce(current);
        while (!next.equals(current)) {
            current = next;
            next = formatOnce(current);
        }
        LOGGER.debug("Formatted line {} as {}", line, current);
        return current;
    }

    static String formatOnce(String line) {
        String text = line.replace(POP_DIRECTIONAL_ISOLATE, "").strip();
        text = LEADING_VACAT.matcher(text).replaceAll("");
        text = TRAILING_VACAT.matcher(text).replaceAll("");
        if (GAP_CHARACTERS_ONLY.matcher(text).matches()
                && !BRACKETED_DASHES.matcher(text).replaceAll("").contains("-")) {
            return "";
        }
        text = text.replace(EMPTY_BRACKETS, "");
        text = LEADING_GAPS.matcher(text).replaceAll("]");
        text = TRAILING_GAPS.matcher(text).replaceAll("[");
        text = mergeDashGroups(text);
        text = UNKNOWN_WITH_DASH_GROUPS.matcher(text).replaceAll("[?]");
        text = REPEATED_UNKNOWN.matcher(text).replaceAll("[?]");
        text = REPEATED_GENERIC_ABBREVIATION.matcher(text).replaceAll(AbbreviationSymbols.GENERIC);
        return text.toUpperCase(Locale.ROOT);
    }

    // [--][---] -> [-----]
    private static String mergeDashGroups(String text) {
        Matcher matcher = ADJACENT_DASH_GROUPS.matcher(text);
        StringBuilder merged = new StringBuilder();
        while (matcher.find()) {
            long dashes = matcher.group().chars().filter(c -> c == '-').count();
            matcher.appendReplacement(merged, Matcher.quoteReplacement("[" + "-".repeat((int) dashes) + "]"));
        }
        matcher.appendTail(merged);
        return merged.toString();
    }
}
