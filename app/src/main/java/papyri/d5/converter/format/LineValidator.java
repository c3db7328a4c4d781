package papyri.d5.converter.format;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import papyri.d5.converter.normalize.MajusculeNormalizer;
import papyri.d5.converter.symbol.AbbreviationSymbols;
import papyri.d5.converter.symbol.GlyphSymbols;
import papyri.d5.converter.symbol.MilestoneSymbols;
import papyri.d5.converter.symbol.RenditionMarks;
import papyri.d5.converter.transform.AdditionPlacement;

/**
 * Checks a formatted line against the D5 character set and bracket structure.
 *
 * <p>Problems are logged to the document's {@link FormatterState} and never thrown. In documents declared
 * purely Greek, Latin capitals that look like Greek ones are replaced and the line is checked again.
 */
public final class LineValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineValidator.class);

    private static final String TAU_RHO = "\u2CE8";
    private static final String TWO_THIRDS_SIGN = "\uD800\uDD77";

    private static final Map<Integer, Integer> CONFUSABLES = confusables("ABEHIKMNOPTXYZ", "ΑΒΕΗΙΚΜΝΟΡΤΧΥΖ");

    private static final String SYMBOLS = characterClassBody(allowedSymbols());
    private static final Pattern ALLOWED_CHARACTER = Pattern.compile("[" + SYMBOLS + "\\[\\]\\-?]");
    private static final String RUN = "[\\-" + SYMBOLS + "]+";
    private static final String MIDDLE = "[\\-\\[\\]?" + SYMBOLS + "]*";
    private static final Pattern PLAIN_LINE = Pattern.compile("\\]?" + RUN + "\\[?");
    private static final Pattern LINE_WITH_INNER_GAPS = Pattern.compile("\\]?" + RUN + MIDDLE + RUN + "\\[?");

    private LineValidator() {
    }

    /**
     * Validates a formatted line, correcting Latin look-alike letters where the document allows it.
     *
     * @return the line, corrected if a correction was applied
     * @throws IllegalStateException if corrections do not converge
     */
    public static String validateLine(String line, FormatterState state) {
        LOGGER.debug("Validating line {}", line);
        int mark = state.errorMark();
        String current = line;
        for (int pass = 0; pass <= CONFUSABLES.size(); pass++) {
            if (isWellFormed(current)) {
                return checkEmptyBrackets(current, state);
            }
            List<String> forbidden = forbiddenCharacters(current);
            if (forbidden.isEmpty()) {
                logError(state, "Invalid gap handling: " + current);
                return checkEmptyBrackets(current, state);
            }
            logError(state, "Forbidden character(s) " + forbidden + " found in \"" + current + "\"");
            if (!state.isPurelyGreek()) {
                return checkEmptyBrackets(current, state);
            }
            List<String> changes = new ArrayList<>();
            for (String character : forbidden) {
                Integer greek = CONFUSABLES.get(character.codePointAt(0));
                if (greek == null) {
                    continue;
                }
                state.discardErrorsSince(mark);
                String replacement = Character.toString(greek);
                current = current.replace(character, replacement);
                String change = "Changed \"" + character + "\" to \"" + replacement + "\" in " + current;
                LOGGER.info(change);
                changes.add(change);
            }
            if (changes.isEmpty()) {
                return checkEmptyBrackets(current, state);
            }
            state.recordChanges(changes);
        }
        throw new IllegalStateException("Typo correction did not converge for line: " + line);
    }

    static boolean isWellFormed(String line) {
        return PLAIN_LINE.matcher(line).matches() || LINE_WITH_INNER_GAPS.matcher(line).matches();
    }

    /**
     * @return the distinct characters outside the D5 character set, in order of appearance
     */
    static List<String> forbiddenCharacters(String line) {
        Set<String> forbidden = new LinkedHashSet<>();
        line.codePoints()
                .mapToObj(Character::toString)
                .filter(character -> !ALLOWED_CHARACTER.matcher(character).matches())
                .forEach(forbidden::add);
        return List.copyOf(forbidden);
    }

    private static String checkEmptyBrackets(String line, FormatterState state) {
        if (line.contains("[]")) {
            logError(state, "Contains \"[]\"");
        }
        return line;
    }

    private static void logError(FormatterState state, String diagnostic) {
        LOGGER.warn(diagnostic);
        state.logError(diagnostic);
    }

    // every symbol any transformation rule can emit is a legal output character
    private static Set<Integer> allowedSymbols() {
        Set<Integer> codePoints = new TreeSet<>();
        Stream.of(
                        List.of(MajusculeNormalizer.OUTPUT_ALPHABET, AbbreviationSymbols.GENERIC, RenditionMarks.UNCLEAR,
                                TAU_RHO, TWO_THIRDS_SIGN, " "),
                        MilestoneSymbols.symbols(),
                        AbbreviationSymbols.symbols(),
                        GlyphSymbols.symbols(),
                        AdditionPlacement.symbols(),
                        RenditionMarks.marks())
                .flatMap(Collection::stream)
                .flatMapToInt(String::codePoints)
                .forEach(codePoints::add);
        return codePoints;
    }

    private static String characterClassBody(Set<Integer> codePoints) {
        return codePoints.stream()
                .map(codePoint -> String.format("\\x{%X}", codePoint))
                .collect(Collectors.joining());
    }

    private static Map<Integer, Integer> confusables(String latin, String greek) {
        int[] from = latin.codePoints().toArray();
        int[] to = greek.codePoints().toArray();
        return IntStream.range(0, from.length)
                .boxed()
                .collect(Collectors.toUnmodifiableMap(i -> from[i], i -> to[i]));
    }
}
