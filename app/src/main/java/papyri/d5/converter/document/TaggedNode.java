package papyri.d5.converter.document;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Read-only view of one node of an already parsed EpiDoc document.
 */
public interface TaggedNode {

    /**
     * @return the tag name, or an empty string for text nodes
     */
    String name();

    boolean isText();

    Optional<String> attribute(String key);

    /**
     * @return attributes in document order, keys are case-sensitive
     */
    Map<String, String> attributes();

    /**
     * @return element and text children in document order
     */
    List<TaggedNode> children();

    /**
     * @return all text reachable from this node, whitespace preserved
     */
    String text();

    /**
     * @return all element descendants in document order, excluding this node
     */
    Stream<TaggedNode> descendants();

    /**
     * @return the element and text siblings following this node in document order
     */
    List<TaggedNode> followingSiblings();

    /**
     * @return the closest enclosing element named {@code name}
     */
    Optional<TaggedNode> closestAncestor(String name);

    default boolean is(String tagName) {
        return !isText() && name().equals(tagName);
    }

    default boolean hasAttribute(String key) {
        return attribute(key).isPresent();
    }
}
