package papyri.d5.converter.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * {@link TaggedNode} backed by a jsoup node parsed in XML mode.
 */
final class JsoupTaggedNode implements TaggedNode {

    private final Node node;

    private JsoupTaggedNode(Node node) {
        this.node = Objects.requireNonNull(node, "node");
    }

    static TaggedNode wrap(Node node) {
        return new JsoupTaggedNode(node);
    }

    static boolean isVisible(Node node) {
        return node instanceof Element || node instanceof TextNode;
    }

    @Override
    public String name() {
        return node instanceof Element element ? element.tagName() : "";
    }

    @Override
    public boolean isText() {
        return node instanceof TextNode;
    }

    @Override
    public Optional<String> attribute(String key) {
        if (!(node instanceof Element) || !node.hasAttr(key)) {
            return Optional.empty();
        }
        return Optional.of(node.attr(key));
    }

    @Override
    public Map<String, String> attributes() {
        if (!(node instanceof Element)) {
            return Map.of();
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        for (Attribute attribute : node.attributes()) {
            attributes.put(attribute.getKey(), attribute.getValue());
        }
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public List<TaggedNode> children() {
        return wrapVisible(node.childNodes());
    }

    @Override
    public String text() {
        if (node instanceof TextNode textNode) {
            return textNode.getWholeText();
        }
        return ((Element) node).wholeText();
    }

    @Override
    public Stream<TaggedNode> descendants() {
        if (!(node instanceof Element element)) {
            return Stream.empty();
        }
        return element.getAllElements().stream()
                .skip(1)
                .map(JsoupTaggedNode::wrap);
    }

    @Override
    public List<TaggedNode> followingSiblings() {
        Node parent = node.parentNode();
        if (parent == null) {
            return List.of();
        }
        List<Node> siblings = parent.childNodes();
        return wrapVisible(siblings.subList(node.siblingIndex() + 1, siblings.size()));
    }

    @Override
    public Optional<TaggedNode> closestAncestor(String name) {
        Element ancestor = node.parent() instanceof Element parent ? parent : null;
        while (ancestor != null) {
            if (ancestor.tagName().equals(name)) {
                return Optional.of(wrap(ancestor));
            }
            ancestor = ancestor.parent();
        }
        return Optional.empty();
    }

    private static List<TaggedNode> wrapVisible(List<Node> nodes) {
        List<TaggedNode> wrapped = new ArrayList<>(nodes.size());
        for (Node child : nodes) {
            if (isVisible(child)) {
                wrapped.add(wrap(child));
            }
        }
        return wrapped;
    }

    @Override
    public String toString() {
        return node.outerHtml();
    }
}
