package org.metapatch.xml;

import java.util.List;

/**
 * Recovers the whitespace used around a container's children.
 * <p>
 * Results depend on the current shape of the tree, so callers ask again after every insert or remove instead of
 * caching gaps.
 */
public final class IndentationInferencer {

    private final String unit;
    private final String lineEnding;

    public IndentationInferencer(String unit, String lineEnding) {
        this.unit = unit;
        this.lineEnding = lineEnding;
    }

    /**
     * Infers the indent unit from the gap before the root's first child, falling back to {@code fallbackUnit} for
     * documents whose root has no indented children.
     */
    public static IndentationInferencer forDocument(XmlDocument document, String fallbackUnit) {
        String unit = null;
        XmlNode root = document.root();
        if (root.hasChildren()) {
            String indent = XmlText.indentOf(XmlText.trailingBreak(root.head()));
            if (!indent.isEmpty()) unit = indent;
        }
        return new IndentationInferencer(unit != null ? unit : fallbackUnit, document.lineEnding());
    }

    public String unit() {
        return unit;
    }

    public String lineEnding() {
        return lineEnding;
    }

    /** Line break plus indentation that precedes a child of {@code container}. */
    public String childGap(XmlNode container) {
        if (container.hasChildren()) {
            String head = XmlText.trailingBreak(container.head());
            if (head != null) return head;
            String found = null;
            List<XmlNode> children = container.children();
            for (int i = 0; i < children.size() - 1; i++) {
                String tb = XmlText.trailingBreak(children.get(i).tail());
                if (tb != null) found = tb;
            }
            if (found != null) return found;
            return gapForDepth(container.depth() + 1);
        }
        String own = precedingBreak(container);
        return own != null ? own + unit : gapForDepth(container.depth() + 1);
    }

    /** Whitespace between the last child (or the open tag) and the end tag of {@code container}. */
    public String closingGap(XmlNode container) {
        if (container.hasChildren()) {
            List<XmlNode> children = container.children();
            String tb = XmlText.trailingBreak(children.get(children.size() - 1).tail());
            if (tb != null) return tb;
        } else {
            String tb = XmlText.trailingBreak(container.head());
            if (tb != null) return tb;
        }
        String own = precedingBreak(container);
        return own != null ? own : gapForDepth(container.depth());
    }

    public String gapForDepth(int depth) {
        return lineEnding + unit.repeat(Math.max(0, depth));
    }

    /** The line break in front of the container's own open tag, when there is one. */
    private static String precedingBreak(XmlNode node) {
        XmlNode parent = node.parent();
        if (parent == null) return null;
        int index = node.indexInParent();
        String gap = index == 0 ? parent.head() : parent.children().get(index - 1).tail();
        return XmlText.trailingBreak(gap);
    }
}
