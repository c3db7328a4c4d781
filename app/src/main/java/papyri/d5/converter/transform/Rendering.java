package papyri.d5.converter.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Immutable result of transforming a piece of markup: text split at line breaks, each line carrying the
 * insertions requested on it. A rendering always has at least one (possibly empty) line; appending another
 * rendering continues the last line with the other's first line.
 */
public final class Rendering {

    private static final Rendering EMPTY = new Rendering(List.of(RawLine.of("")));

    private final List<RawLine> lines;

    private Rendering(List<RawLine> lines) {
        this.lines = List.copyOf(lines);
    }

    public static Rendering empty() {
        return EMPTY;
    }

    public static Rendering of(String text) {
        if (text == null || text.isEmpty()) {
            return EMPTY;
        }
        return new Rendering(List.of(RawLine.of(text)));
    }

    public static Rendering lineBreak() {
        return new Rendering(List.of(RawLine.of(""), RawLine.of("")));
    }

    public static Rendering deferred(InsertionRequest request) {
        return new Rendering(List.of(new RawLine("", List.of(request))));
    }

    public Rendering append(Rendering other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<RawLine> joined = new ArrayList<>(lines.size() + other.lines.size());
        joined.addAll(lines.subList(0, lines.size() - 1));
        joined.add(lines.get(lines.size() - 1).join(other.lines.get(0)));
        joined.addAll(other.lines.subList(1, other.lines.size()));
        return new Rendering(joined);
    }

    public Rendering append(String text) {
        return append(of(text));
    }

    /**
     * Applies {@code operator} to the text of every line and to the text of every insertion requested on it.
     */
    public Rendering mapText(UnaryOperator<String> operator) {
        return new Rendering(lines.stream()
                .map(line -> line.mapText(operator))
                .collect(Collectors.toList()));
    }

    public Rendering withoutSpaces() {
        return mapText(text -> text.replace(" ", ""));
    }

    /**
     * @return the rendered text with line breaks as {@code \n}, without insertion payloads
     */
    public String plainText() {
        return lines.stream().map(RawLine::text).collect(Collectors.joining("\n"));
    }

    public List<InsertionRequest> insertions() {
        return lines.stream()
                .flatMap(line -> line.insertions().stream())
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * @return a rendering holding only this rendering's insertions, all on one line
     */
    public Rendering insertionsOnly() {
        List<InsertionRequest> insertions = insertions();
        if (insertions.isEmpty()) {
            return EMPTY;
        }
        return new Rendering(List.of(new RawLine("", insertions)));
    }

    /**
     * True if the rendering produces neither text, line breaks nor insertions.
     */
    public boolean isEmpty() {
        return lines.size() == 1 && lines.get(0).isBlank();
    }

    public List<RawLine> lines() {
        return lines;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Rendering rendering && lines.equals(rendering.lines);
    }

    @Override
    public int hashCode() {
        return lines.hashCode();
    }

    @Override
    public String toString() {
        return "Rendering" + lines;
    }
}
