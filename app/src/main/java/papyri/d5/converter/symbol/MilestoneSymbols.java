package papyri.d5.converter.symbol;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Symbols for {@code <milestone rend="...">}. A milestone always opens a new line holding its symbol.
 */
public final class MilestoneSymbols {

    private static final Map<String, String> TABLE = Map.of(
            "paragraphos", "\u2E0F",
            "horizontal-rule", "\u2015",
            "diple-obelismene", "\u2E10",
            "wavy-line", "\u223C",
            "coronis", "\u2E0E");

    private MilestoneSymbols() {
    }

    public static Optional<String> symbolFor(String rend) {
        if (rend == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(TABLE.get(rend));
    }

    public static Collection<String> symbols() {
        return TABLE.values();
    }
}
