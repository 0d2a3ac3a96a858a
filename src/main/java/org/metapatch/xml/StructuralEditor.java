package org.metapatch.xml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Splices fragments into, and removes nodes from, a loaded document while re-threading the whitespace gaps so that
 * exactly one gap separates each pair of siblings. Nothing outside the touched boundary changes.
 */
public final class StructuralEditor {

    private static final Logger logger = LoggerFactory.getLogger(StructuralEditor.class);

    private final XmlDocument document;
    private final IndentationInferencer indentation;
    private final List<String> warnings = new ArrayList<>();

    public StructuralEditor(XmlDocument document, IndentationInferencer indentation) {
        this.document = document;
        this.indentation = indentation;
    }

    public XmlDocument document() {
        return document;
    }

    public IndentationInferencer indentation() {
        return indentation;
    }

    /** Appends {@code fragment} as the last child of {@code container}. */
    public XmlNode append(XmlNode container, XmlNode fragment) {
        return insert(container, fragment, null, null);
    }

    /**
     * Inserts {@code fragment} before the first child that sorts after {@code key} under {@code spec}, or appends it
     * when no such child exists (or no key is given).
     */
    public XmlNode insert(XmlNode container, XmlNode fragment, OrderSpec spec, OrderKey key) {
        if (fragment.parent() != null) throw new IllegalArgumentException("Fragment is already attached: " + fragment);
        int index = spec == null || key == null ? container.children().size() : position(container, spec, key);
        String gap = indentation.childGap(container);
        List<XmlNode> children = container.children();

        if (children.isEmpty()) {
            String closing = indentation.closingGap(container);
            container.ensureOpen();
            container.setHead(XmlText.stripTrailingWhitespace(container.head()) + gap);
            fragment.setTail(closing);
        } else if (index >= children.size()) {
            XmlNode last = children.get(children.size() - 1);
            String body = XmlText.stripTrailingWhitespace(last.tail());
            String closing = last.tail().substring(body.length());
            last.setTail(body + gap);
            fragment.setTail(closing);
        } else if (index == 0) {
            String before = XmlText.trailingBreak(container.head());
            fragment.setTail(before != null ? before : gap);
        } else {
            XmlNode previous = children.get(index - 1);
            String body = XmlText.stripTrailingWhitespace(previous.tail());
            String between = previous.tail().substring(body.length());
            previous.setTail(body + gap);
            fragment.setTail(between.isEmpty() ? gap : between);
        }
        container.insertChild(Math.min(index, children.size()), fragment);
        document.markModified();
        logger.debug("Inserted <{}> into {} at position {}", fragment.name(), container.path(), index);
        return fragment;
    }

    /**
     * Child index at which an entry ordered by {@code key} belongs. Children whose kind the order does not know are
     * passed over with a warning.
     */
    int position(XmlNode container, OrderSpec spec, OrderKey key) {
        int own = spec.indexOf(key.kind());
        if (own < 0) {
            warn("Kind <" + key.kind() + "> is not ordered in " + spec.container() + ", appending");
            return container.children().size();
        }
        List<XmlNode> children = container.children();
        for (int i = 0; i < children.size(); i++) {
            XmlNode child = children.get(i);
            int index = spec.indexOf(child.name());
            if (index < 0) {
                warn("Unexpected <" + child.name() + "> in " + container.path() + " skipped while ordering");
                continue;
            }
            if (index > own) return i;
            if (index == own && key.displayKey() != null && spec.sortsByDisplayKey()) {
                String other = spec.displayKeyOf(child);
                if (other != null && other.compareToIgnoreCase(key.displayKey()) > 0) return i;
            }
        }
        return children.size();
    }

    /**
     * Detaches {@code node}; the whitespace that preceded it is dropped and its tail moves to the predecessor (or to
     * the container head when it was the first child). Comments in the preceding gap are kept.
     */
    public void remove(XmlNode node) {
        XmlNode parent = node.parent();
        if (parent == null) throw new IllegalArgumentException("Cannot remove the document root");
        int index = node.indexInParent();
        if (index == 0) {
            parent.setHead(XmlText.stripTrailingWhitespace(parent.head()) + node.tail());
        } else {
            XmlNode previous = parent.children().get(index - 1);
            previous.setTail(XmlText.stripTrailingWhitespace(previous.tail()) + node.tail());
        }
        parent.removeChild(node);
        node.setTail("");
        document.markModified();
        logger.debug("Removed <{}> from {}", node.name(), parent.path());
    }

    /**
     * Replaces the scalar text of a leaf element. Returns false when the text is already equal.
     */
    public boolean replaceText(XmlNode node, String text) {
        if (node.hasChildren()) throw new IllegalArgumentException("Element has child elements: " + node.path());
        if (!node.isSelfClosing() && node.text().equals(text)) return false;
        node.ensureOpen();
        node.setHead(XmlText.escape(text));
        document.markModified();
        return true;
    }

    /** Drops every child; the container is written back self-closed. Returns the number of children removed. */
    public int clearChildren(XmlNode container) {
        return clearChildren(container, null);
    }

    /**
     * Drops the children named {@code childName} (every child when null) and keeps the others in place. A container
     * left without children is written back self-closed. Returns the number of children removed.
     */
    public int clearChildren(XmlNode container, String childName) {
        List<XmlNode> targets = childName == null ? container.children() : container.children(childName);
        int count = targets.size();
        if (count == 0) return 0;
        if (count == container.children().size()) {
            container.collapse();
        } else {
            for (XmlNode child : List.copyOf(targets)) remove(child);
        }
        document.markModified();
        logger.debug("Cleared {} children of {}", count, container.path());
        return count;
    }

    /** Returns the child named {@code name}, creating it as an empty element in canonical position when missing. */
    public XmlNode ensureChild(XmlNode container, String name, OrderSpec spec) {
        XmlNode existing = container.child(name);
        if (existing != null) return existing;
        return insert(container, XmlNode.empty(name), spec, OrderKey.of(name));
    }

    private void warn(String message) {
        logger.warn(message);
        warnings.add(message);
    }

    /** Structural warnings collected since the previous call. */
    public List<String> drainWarnings() {
        List<String> out = new ArrayList<>(warnings);
        warnings.clear();
        return out;
    }
}
