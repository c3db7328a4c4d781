package papyri.d5.converter.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * One not yet validated output line together with the insertions requested while it was built.
 */
public record RawLine(String text, List<InsertionRequest> insertions) {

    public RawLine {
        Objects.requireNonNull(text, "text");
        insertions = insertions == null ? List.of() : List.copyOf(insertions);
    }

    public static RawLine of(String text) {
        return new RawLine(text, List.of());
    }

    /**
     * A line carries information if it has text or pending insertions.
     */
    public boolean isBlank() {
        return text.isEmpty() && insertions.isEmpty();
    }

    RawLine join(RawLine continuation) {
        List<InsertionRequest> joined = new ArrayList<>(insertions);
        joined.addAll(continuation.insertions());
        return new RawLine(text + continuation.text(), joined);
    }

    RawLine mapText(UnaryOperator<String> operator) {
        List<InsertionRequest> mapped = insertions.stream()
                .map(request -> request.withText(operator.apply(request.text())))
                .collect(Collectors.toList());
        return new RawLine(operator.apply(text), mapped);
    }
}
