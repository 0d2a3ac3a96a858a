package org.metapatch.xml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Element of a loaded document.
 * <p>
 * Formatting is stored as data: {@code head} is the literal text between the open tag and the first child (the whole
 * content for a leaf), {@code tail} the literal text between the end of this element and the next sibling or the
 * parent's end tag. Nodes read from a file keep their raw tag text, so an untouched element serializes to exactly the
 * bytes it was parsed from.
 */
public final class XmlNode {

    private final String name;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<XmlNode> children = new ArrayList<>();
    private String openTag;
    private String closeTag;
    private boolean selfClosing;
    private String head = "";
    private String tail = "";
    private XmlNode parent;

    private XmlNode(String name) {
        this.name = name;
    }

    /* ===================== Fragment construction ===================== */

    public static XmlNode element(String name) {
        return new XmlNode(name);
    }

    public static XmlNode leaf(String name, String text) {
        XmlNode node = new XmlNode(name);
        node.head = XmlText.escape(text);
        return node;
    }

    /** Self-closed marker element ({@code <name/>}). */
    public static XmlNode empty(String name) {
        XmlNode node = new XmlNode(name);
        node.selfClosing = true;
        return node;
    }

    static XmlNode parsed(String name, String openTag, boolean selfClosing) {
        XmlNode node = new XmlNode(name);
        node.openTag = openTag;
        node.selfClosing = selfClosing;
        return node;
    }

    public XmlNode attr(String attrName, String value) {
        attributes.put(attrName, value);
        openTag = null;
        return this;
    }

    public XmlNode add(XmlNode child) {
        if (selfClosing) selfClosing = false;
        child.parent = this;
        children.add(child);
        return this;
    }

    /**
     * Lays out a freshly built fragment: {@code ownGap} is the line break and indentation preceding this node, each
     * nesting level adds {@code unit}. The node's own tail is left to the editor.
     */
    public XmlNode layout(String ownGap, String unit) {
        if (children.isEmpty()) return this;
        String childGap = ownGap + unit;
        head = childGap;
        for (int i = 0; i < children.size(); i++) {
            XmlNode child = children.get(i);
            child.layout(childGap, unit);
            child.tail = i == children.size() - 1 ? ownGap : childGap;
        }
        return this;
    }

    /* ===================== Accessors ===================== */

    public String name() {
        return name;
    }

    public String localName() {
        int colon = name.indexOf(':');
        return colon < 0 ? name : name.substring(colon + 1);
    }

    public String attribute(String attrName) {
        return attributes.get(attrName);
    }

    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public List<XmlNode> children() {
        return Collections.unmodifiableList(children);
    }

    public List<XmlNode> children(String childName) {
        List<XmlNode> out = new ArrayList<>();
        for (XmlNode c : children) {
            if (c.name.equals(childName)) out.add(c);
        }
        return out;
    }

    public XmlNode child(String childName) {
        for (XmlNode c : children) {
            if (c.name.equals(childName)) return c;
        }
        return null;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public XmlNode parent() {
        return parent;
    }

    public int indexInParent() {
        return parent == null ? -1 : parent.children.indexOf(this);
    }

    public int depth() {
        int depth = 0;
        for (XmlNode p = parent; p != null; p = p.parent) depth++;
        return depth;
    }

    public String head() {
        return head;
    }

    public String tail() {
        return tail;
    }

    public boolean isSelfClosing() {
        return selfClosing;
    }

    /** Decoded text content, "" for elements with children or without content. */
    public String text() {
        if (selfClosing || !children.isEmpty()) return "";
        return XmlText.decode(head);
    }

    /**
     * Resolves a relative selector: "" is this node's text, "@attr" an attribute, "a/b" the text of the first matching
     * descendant, "a/@attr" an attribute of it. Returns {@code null} when nothing matches.
     */
    public String select(String selector) {
        if (selector == null || selector.isEmpty()) return text();
        XmlNode current = this;
        String[] steps = selector.split("/");
        for (int i = 0; i < steps.length; i++) {
            String step = steps[i];
            if (step.startsWith("@")) {
                return i == steps.length - 1 ? current.attribute(step.substring(1)) : null;
            }
            current = current.child(step);
            if (current == null) return null;
        }
        return current.text();
    }

    /** Texts of every node {@code selector} reaches, in document order; {@link #select} only follows first matches. */
    public List<String> selectAll(String selector) {
        List<String> out = new ArrayList<>();
        if (selector == null || selector.isEmpty()) {
            out.add(text());
            return out;
        }
        collect(this, selector.split("/"), 0, out);
        return out;
    }

    private static void collect(XmlNode node, String[] steps, int index, List<String> out) {
        String step = steps[index];
        if (step.startsWith("@")) {
            String value = index == steps.length - 1 ? node.attribute(step.substring(1)) : null;
            if (value != null) out.add(value);
            return;
        }
        for (XmlNode child : node.children(step)) {
            if (index == steps.length - 1) out.add(child.text());
            else collect(child, steps, index + 1, out);
        }
    }

    /** Slash separated element names from the root, used in diagnostics. */
    public String path() {
        String label = name;
        String n = attribute("name");
        if (n != null) label += "[@name='" + n + "']";
        else {
            XmlNode nameChild = child("name");
            if (nameChild == null) nameChild = child("dcsset:name");
            if (nameChild != null && !nameChild.hasChildren()) label += "[" + nameChild.text() + "]";
        }
        return parent == null ? "/" + label : parent.path() + "/" + label;
    }

    /* ===================== Mutation (editor only) ===================== */

    void setHead(String head) {
        this.head = head == null ? "" : head;
    }

    void setTail(String tail) {
        this.tail = tail == null ? "" : tail;
    }

    void setCloseTag(String closeTag) {
        this.closeTag = closeTag;
    }

    void insertChild(int index, XmlNode child) {
        child.parent = this;
        children.add(index, child);
    }

    void removeChild(XmlNode child) {
        children.remove(child);
        child.parent = null;
    }

    void clear() {
        for (XmlNode c : children) c.parent = null;
        children.clear();
    }

    /** Turns {@code <x/>} into {@code <x></x>} so that content can be added. */
    void ensureOpen() {
        if (!selfClosing) return;
        selfClosing = false;
        if (openTag != null) {
            String raw = openTag.substring(0, openTag.length() - 2);
            openTag = XmlText.stripTrailingWhitespace(raw) + ">";
        }
        closeTag = null;
        head = "";
    }

    /** Turns an element into a self-closed one, dropping its content. */
    void collapse() {
        clear();
        head = "";
        if (selfClosing) return;
        selfClosing = true;
        if (openTag != null) {
            openTag = openTag.substring(0, openTag.length() - 1) + "/>";
        }
        closeTag = null;
    }

    /* ===================== Serialization ===================== */

    public String toXml() {
        StringBuilder sb = new StringBuilder();
        write(sb);
        return sb.toString();
    }

    void write(StringBuilder out) {
        out.append(openTag != null ? openTag : renderOpenTag());
        if (selfClosing) return;
        out.append(head);
        for (XmlNode c : children) {
            c.write(out);
            out.append(c.tail);
        }
        out.append(closeTag != null ? closeTag : "</" + name + ">");
    }

    private String renderOpenTag() {
        StringBuilder sb = new StringBuilder("<").append(name);
        for (Map.Entry<String, String> e : attributes.entrySet()) {
            sb.append(' ').append(e.getKey()).append("=\"").append(XmlText.escapeAttribute(e.getValue())).append('"');
        }
        return sb.append(selfClosing ? "/>" : ">").toString();
    }

    void putParsedAttribute(String attrName, String value) {
        attributes.put(attrName, value);
    }

    @Override
    public String toString() {
        return "<" + name + ">" + (parent == null ? "" : " at " + path());
    }
}
