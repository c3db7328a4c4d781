package papyri.d5.converter.transform;

import java.util.Objects;

/**
 * Text of an interlinear or marginal addition that becomes a line of its own.
 */
public record InsertionRequest(InsertionSide side, String text) {

    public InsertionRequest {
        Objects.requireNonNull(side, "side");
        text = text == null ? "" : text;
    }

    public static InsertionRequest before(String text) {
        return new InsertionRequest(InsertionSide.BEFORE, text);
    }

    public static InsertionRequest after(String text) {
        return new InsertionRequest(InsertionSide.AFTER, text);
    }

    InsertionRequest withText(String replacement) {
        return new InsertionRequest(side, replacement);
    }
}
