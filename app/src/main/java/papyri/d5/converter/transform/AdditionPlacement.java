package papyri.d5.converter.transform;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Placement policy for {@code <add place="...">}: additions written above, below or beside the line are moved
 * to a line of their own and leave an arrow behind; margin, top and bottom notes only leave their sign.
 */
public enum AdditionPlacement {
    ABOVE("above", "\u2191"),
    BELOW("below", "\u2193"),
    LEFT("left", "\u2190"),
    RIGHT("right", "\u2192"),
    MARGIN("margin", "\u2194"),
    BOTTOM("bottom", "\u21A1"),
    TOP("top", "\u219F"),
    INTERLINEAR("interlinear", "");

    private final String place;
    private final String symbol;

    AdditionPlacement(String place, String symbol) {
        this.place = place;
        this.symbol = symbol;
    }

    public static Optional<AdditionPlacement> of(String place) {
        return Arrays.stream(values())
                .filter(value -> value.place.equals(place))
                .findFirst();
    }

    public static List<String> symbols() {
        return Arrays.stream(values())
                .map(AdditionPlacement::symbol)
                .filter(symbol -> !symbol.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Renders an addition.
     *
     * @param place   value of the {@code place} attribute, may be {@code null}
     * @param content the transformed content of the addition
     */
    public static Rendering render(String place, Rendering content) {
        Optional<AdditionPlacement> placement = of(place);
        if (placement.isEmpty()) {
            return content;
        }
        String text = content.plainText().replace("\n", "");
        return placement.get().render(text).append(content.insertionsOnly());
    }

    Rendering render(String text) {
        return switch (this) {
            case ABOVE -> above(text);
            case BELOW, RIGHT -> Rendering.of(symbol).append(Rendering.deferred(InsertionRequest.after(text)));
            case LEFT -> Rendering.of(symbol).append(Rendering.deferred(InsertionRequest.before(text)));
            case MARGIN, BOTTOM, TOP -> Rendering.of(symbol);
            case INTERLINEAR -> Rendering.deferred(InsertionRequest.before(text));
        };
    }

    // a single letter above the line stays inline
    private Rendering above(String text) {
        int length = text.codePointCount(0, text.length());
        if (length > 1) {
            return Rendering.of(symbol).append(Rendering.deferred(InsertionRequest.before(text)));
        }
        return Rendering.of(text);
    }
}
