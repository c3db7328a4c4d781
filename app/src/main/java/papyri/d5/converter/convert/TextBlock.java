package papyri.d5.converter.convert;

import java.util.List;
import java.util.Objects;

/**
 * The validated lines of one {@code <ab>} together with the {@code n} and {@code subtype} of its enclosing
 * {@code <div>} (empty when absent).
 */
public record TextBlock(String n, String subtype, List<String> lines) {

    public TextBlock {
        n = n == null ? "" : n;
        subtype = subtype == null ? "" : subtype;
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
    }
}
