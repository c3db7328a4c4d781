package papyri.d5.converter.transform;

import java.util.Map;

/**
 * Renders {@code <gap>} and {@code <space>} from their extent attributes.
 *
 * <p>Illegible gaps become bare dashes, one per unreadable letter. Gaps caused by loss are bracketed. Any
 * attribute the policy needs but cannot read yields the unknown-extent placeholder.
 */
public final class GapRenderer {

    public static final String UNKNOWN_EXTENT = "[?]";
    static final String UNKNOWN_SPACE = " ? ";

    private GapRenderer() {
    }

    public static String gap(Map<String, String> attributes) {
        try {
            if (require(attributes, "unit").equals("line")) {
                return "";
            }
            if (require(attributes, "reason").equals("illegible")) {
                if (attributes.containsKey("quantity")) {
                    return dashes(integer(attributes, "quantity"));
                }
                if (attributes.containsKey("atLeast") && attributes.containsKey("atMost")) {
                    return dashes(average(attributes));
                }
                return UNKNOWN_EXTENT;
            }
            if (attributes.containsKey("quantity")) {
                return bracketed(dashes(integer(attributes, "quantity")));
            }
            if (attributes.containsKey("extent")) {
                return attributes.get("extent").equals("unknown") ? UNKNOWN_EXTENT : "";
            }
            if (attributes.containsKey("atLeast")) {
                return bracketed(dashes(average(attributes)));
            }
            return UNKNOWN_EXTENT;
        } catch (IllegalArgumentException ex) {
            return UNKNOWN_EXTENT;
        }
    }

    public static String space(Map<String, String> attributes) {
        try {
            if (require(attributes, "unit").equals("line")) {
                return "";
            }
            if (attributes.containsKey("quantity")) {
                return " ".repeat(Math.max(0, integer(attributes, "quantity")));
            }
            if (attributes.containsKey("atLeast")) {
                return " ".repeat(Math.max(0, average(attributes)));
            }
            if (attributes.containsKey("extent")) {
                return UNKNOWN_SPACE;
            }
            return "";
        } catch (IllegalArgumentException ex) {
            return UNKNOWN_SPACE;
        }
    }

    static String dashes(int count) {
        return "-".repeat(Math.max(0, count));
    }

    private static String bracketed(String dashes) {
        return "[" + dashes + "]";
    }

    // half-to-even, so 2.5 rounds to 2 and 9.5 to 10
    private static int average(Map<String, String> attributes) {
        int atLeast = integer(attributes, "atLeast");
        int atMost = integer(attributes, "atMost");
        return (int) Math.rint((atLeast + atMost) / 2.0);
    }

    private static int integer(Map<String, String> attributes, String key) {
        return Integer.parseInt(require(attributes, key).trim());
    }

    private static String require(Map<String, String> attributes, String key) {
        String value = attributes.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing attribute " + key);
        }
        return value;
    }
}
