package papyri.d5.converter.transform;

import static papyri.d5.converter.normalize.MajusculeNormalizer.normalize;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import papyri.d5.converter.document.TaggedNode;
import papyri.d5.converter.symbol.AbbreviationSymbols;
import papyri.d5.converter.symbol.GlyphSymbols;
import papyri.d5.converter.symbol.MilestoneSymbols;
import papyri.d5.converter.symbol.RenditionMarks;

/**
 * Walks the markup of one {@code <ab>} text block and renders it into raw D5 lines.
 *
 * <p>The transformer holds no per-document state and can be shared between worker threads as long as its
 * {@link UnimplementedMarkupRecorder} is thread-safe.
 */
public class TagTransformer {

    private static final Logger LOGGER = LoggerFactory.getLogger(TagTransformer.class);

    private static final String SUBST = Tag.SUBST.tagName();

    private final UnimplementedMarkupRecorder recorder;

    public TagTransformer() {
        this(UnimplementedMarkupRecorder.NONE);
    }

    public TagTransformer(UnimplementedMarkupRecorder recorder) {
        this.recorder = Objects.requireNonNull(recorder, "recorder");
    }

    /**
     * Renders everything following the first line break of a text block.
     *
     * @return empty if the block contains no {@code <lb>}
     */
    public Optional<Rendering> transformBlock(TaggedNode block) {
        Optional<TaggedNode> firstLineBreak = block.descendants()
                .filter(node -> node.is(Tag.LB.tagName()))
                .findFirst();
        if (firstLineBreak.isEmpty()) {
            return Optional.empty();
        }
        Rendering rendering = Rendering.empty();
        for (TaggedNode sibling : firstLineBreak.get().followingSiblings()) {
            if (sibling.isText()) {
                if (sibling.text().isBlank()) {
                    continue;
                }
                String converted = normalize(sibling.text().strip());
                LOGGER.debug("Converted text: {}", converted);
                rendering = rendering.append(converted);
            } else {
                Rendering parsed = parseContents(sibling, "");
                LOGGER.debug("Parsed <{}>: {}", sibling.name(), parsed);
                rendering = rendering.append(parsed);
            }
        }
        return Optional.of(rendering);
    }

    /**
     * Renders one element, recursing into its children unless its rule consumes the whole subtree.
     *
     * @param parentName name of the element the node was reached from, empty at block level
     */
    Rendering parseContents(TaggedNode node, String parentName) {
        Tag tag = Tag.of(node.name());
        if (tag == Tag.REG || parentName.equals(Tag.REG.tagName())) {
            return Rendering.empty();
        }
        if (tag == Tag.RDG || (tag == Tag.DEL && parentName.isEmpty())) {
            return Rendering.empty();
        }
        List<TaggedNode> children = node.children();
        if (children.isEmpty() || tag.rendersWholeSubtree()) {
            Rendering rendered = transform(tag, node, normalize(node.text().strip()), parentName);
            return tag == Tag.SPACE ? rendered : rendered.withoutSpaces();
        }
        Rendering parsed = Rendering.empty();
        for (TaggedNode child : children) {
            if (child.isText()) {
                parsed = parsed.append(transform(tag, node, normalize(child.text().strip()), parentName));
            } else {
                parsed = parsed.append(parseContents(child, node.name()));
            }
        }
        return parsed.withoutSpaces();
    }

    /**
     * Applies the rule of {@code tag}.
     *
     * @param text the already normalized text the rule works on
     */
    Rendering transform(Tag tag, TaggedNode node, String text, String parentName) {
        return switch (tag) {
            case LB -> Rendering.lineBreak();
            case GAP -> Rendering.of(GapRenderer.gap(node.attributes()));
            case SPACE -> Rendering.of(GapRenderer.space(node.attributes()));
            case SUPPLIED -> supplied(node);
            case UNCLEAR -> Rendering.of(RenditionMarks.markEachCharacter(text, RenditionMarks.UNCLEAR));
            case MILESTONE -> milestone(node);
            case EXPAN -> expansion(node);
            case ADD -> AdditionPlacement.render(node.attribute("place").orElse(null), contentOf(node));
            case NUM -> Rendering.of(node.hasAttribute("tick") ? text + "'" : text);
            case LEM, ORIG, SIC, ABBR, Q, SURPLUS -> Rendering.of(text);
            case SUBST -> substitution(node);
            case DEL -> SUBST.equals(parentName) ? Rendering.of(text) : Rendering.empty();
            case G -> Rendering.of(GlyphSymbols.symbolFor(node.attribute("type").orElse(null)));
            case HI -> rendition(node, text);
            case EX, REG, RDG, UNKNOWN -> Rendering.empty();
        };
    }

    // lost text becomes one dash per restored character
    private Rendering supplied(TaggedNode node) {
        if (node.attribute("reason").filter("omitted"::equals).isPresent()) {
            return Rendering.empty();
        }
        String restored = contentOf(node).plainText().replace(" ", "");
        int length = restored.codePointCount(0, restored.length());
        if (length == 0) {
            return Rendering.empty();
        }
        return Rendering.of("[" + GapRenderer.dashes(length) + "]");
    }

    private Rendering milestone(TaggedNode node) {
        Optional<String> rend = node.attribute("rend");
        if (rend.isEmpty()) {
            return Rendering.empty();
        }
        Optional<String> symbol = MilestoneSymbols.symbolFor(rend.get());
        if (symbol.isEmpty()) {
            recorder.record("milestone rend=\"" + rend.get() + "\"");
            return Rendering.empty();
        }
        return Rendering.lineBreak().append(symbol.get());
    }

    private Rendering expansion(TaggedNode node) {
        Rendering spelled = Rendering.empty();
        StringBuilder abbreviated = new StringBuilder();
        for (TaggedNode child : node.children()) {
            if (child.isText()) {
                spelled = spelled.append(normalize(child.text()));
            } else if (child.is(Tag.EX.tagName())) {
                abbreviated.append(AbbreviationSymbols.symbolFor(normalize(child.text().strip())));
            } else {
                spelled = spelled.append(parseContents(child, ""));
            }
        }
        return spelled.isEmpty() ? Rendering.of(abbreviated.toString()) : spelled;
    }

    private Rendering substitution(TaggedNode node) {
        Rendering substituted = Rendering.empty();
        for (TaggedNode child : node.children()) {
            if (child.is(Tag.ADD.tagName()) && child.attribute("place").filter("inline"::equals).isPresent()) {
                substituted = Rendering.of(normalize(child.text()));
                break;
            }
            if (child.is(Tag.DEL.tagName())) {
                for (TaggedNode content : child.children()) {
                    substituted = substituted.append(content.isText()
                            ? Rendering.of(normalize(content.text().strip()))
                            : parseContents(content, SUBST));
                }
            }
        }
        return substituted.mapText(text -> text.replaceAll("\\[-+]", ""));
    }

    /**
     * A nested {@code <hi>} decides the output: its first content followed by the outer and then the inner mark.
     * A nested {@code <gap>} receives the outer rendition.
     */
    private Rendering rendition(TaggedNode node, String text) {
        String rend = node.attribute("rend").orElse(null);
        boolean innerMarkSeen = false;
        for (TaggedNode child : node.children()) {
            if (child.is(Tag.HI.tagName())) {
                String outerMark = RenditionMarks.apply(rend, "");
                String innerMark = RenditionMarks.apply(child.attribute("rend").orElse(null), "");
                innerMarkSeen = !innerMark.isEmpty();
                List<TaggedNode> contents = child.children();
                if (contents.isEmpty()) {
                    continue;
                }
                TaggedNode first = contents.get(0);
                Rendering inner = first.isText()
                        ? Rendering.of(normalize(child.text()))
                        : transform(Tag.of(first.name()), first, normalize(first.text()), Tag.HI.tagName());
                return inner.append(outerMark + innerMark);
            }
            if (child.is(Tag.GAP.tagName())) {
                return Rendering.of(RenditionMarks.apply(rend, GapRenderer.gap(child.attributes())));
            }
        }
        return innerMarkSeen ? Rendering.empty() : Rendering.of(RenditionMarks.apply(rend, text));
    }

    // text children stripped and normalized, element children parsed from block level
    private Rendering contentOf(TaggedNode node) {
        Rendering content = Rendering.empty();
        for (TaggedNode child : node.children()) {
            content = content.append(child.isText()
                    ? Rendering.of(normalize(child.text().strip()))
                    : parseContents(child, ""));
        }
        return content;
    }
}
