package papyri.d5.converter.transform;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The EpiDoc elements the transformer understands. Everything else maps to {@link #UNKNOWN}.
 */
public enum Tag {
    LB("lb"),
    GAP("gap", true),
    SPACE("space", true),
    SUPPLIED("supplied", true),
    UNCLEAR("unclear"),
    MILESTONE("milestone"),
    EXPAN("expan", true),
    EX("ex"),
    ADD("add", true),
    NUM("num"),
    LEM("lem"),
    ORIG("orig"),
    SIC("sic"),
    ABBR("abbr"),
    Q("q"),
    SURPLUS("surplus"),
    SUBST("subst", true),
    DEL("del"),
    G("g"),
    HI("hi", true),
    REG("reg"),
    RDG("rdg"),
    UNKNOWN("");

    private static final Map<String, Tag> BY_NAME = Arrays.stream(values())
            .filter(tag -> tag != UNKNOWN)
            .collect(Collectors.toUnmodifiableMap(Tag::tagName, Function.identity()));

    private final String tagName;
    private final boolean wholeSubtree;

    Tag(String tagName) {
        this(tagName, false);
    }

    Tag(String tagName, boolean wholeSubtree) {
        this.tagName = tagName;
        this.wholeSubtree = wholeSubtree;
    }

    public static Tag of(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        return BY_NAME.getOrDefault(name, UNKNOWN);
    }

    public String tagName() {
        return tagName;
    }

    /**
     * Elements rendered from their complete subtree by their own rule instead of child by child.
     */
    public boolean rendersWholeSubtree() {
        return wholeSubtree;
    }
}
