package org.metapatch.xml;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Character-level parser producing an {@link XmlNode} tree that keeps every byte of the input.
 * <p>
 * Text, comments, CDATA sections and processing instructions inside an element are not modelled as nodes; they are
 * kept verbatim in the head/tail gaps around the child elements.
 */
final class XmlTreeParser {

    private final String s;
    private int pos;

    XmlTreeParser(String s) {
        this.s = s;
    }

    /** Result of a parse: everything before the root element, and the root itself (its tail is the epilogue). */
    record Parsed(String prolog, XmlNode root) {
    }

    Parsed parse() {
        int rootStart = findRootStart();
        if (rootStart < 0) throw new IllegalArgumentException("Malformed XML: no root element");
        String prolog = s.substring(0, rootStart);
        pos = rootStart;
        XmlNode root = parseElement();
        root.setTail(s.substring(pos));
        return new Parsed(prolog, root);
    }

    private int findRootStart() {
        int p = 0;
        while (p < s.length()) {
            int lt = s.indexOf('<', p);
            if (lt < 0 || lt + 1 >= s.length()) return -1;
            char c = s.charAt(lt + 1);
            if (c == '?') {
                p = skipPast(lt, "?>");
            } else if (s.startsWith("<!--", lt)) {
                p = skipPast(lt, "-->");
            } else if (c == '!') {
                p = skipPast(lt, ">");
            } else {
                return lt;
            }
        }
        return -1;
    }

    /** Parses the element starting at {@code pos} (which points at '<') including its end tag. */
    private XmlNode parseElement() {
        int tagStart = pos;
        pos++;
        String name = parseName();
        if (name.isEmpty()) throw malformed("element name expected");

        // attributes
        Map<String, String> attrs = new LinkedHashMap<>();
        while (true) {
            skipWs();
            if (pos >= s.length()) throw malformed("unterminated tag <" + name);
            char c = s.charAt(pos);
            if (c == '>' || (c == '/' && pos + 1 < s.length() && s.charAt(pos + 1) == '>')) break;
            String attr = parseName();
            if (attr.isEmpty()) throw malformed("attribute name expected in <" + name + ">");
            skipWs();
            if (pos >= s.length() || s.charAt(pos) != '=') throw malformed("'=' expected after " + attr);
            pos++;
            skipWs();
            if (pos >= s.length()) throw malformed("unterminated tag <" + name);
            char quote = s.charAt(pos++);
            if (quote != '"' && quote != '\'') throw malformed("quoted value expected for " + attr);
            int vStart = pos;
            while (pos < s.length() && s.charAt(pos) != quote) pos++;
            if (pos >= s.length()) throw malformed("unterminated value of " + attr);
            String value = XmlText.decode(s.substring(vStart, pos));
            pos++;
            attrs.put(attr, value);
        }

        boolean selfClose = s.charAt(pos) == '/';
        pos += selfClose ? 2 : 1;
        XmlNode node = XmlNode.parsed(name, s.substring(tagStart, pos), selfClose);
        attrs.forEach(node::putParsedAttribute);
        if (selfClose) return node;

        // content
        int textStart = pos;
        XmlNode last = null;
        while (true) {
            int lt = s.indexOf('<', pos);
            if (lt < 0) throw malformed("element <" + name + "> is not closed");
            if (s.startsWith("<!--", lt)) {
                pos = skipPast(lt, "-->");
                continue;
            }
            if (s.startsWith("<![CDATA[", lt)) {
                pos = skipPast(lt, "]]>");
                continue;
            }
            if (lt + 1 < s.length() && (s.charAt(lt + 1) == '?' || s.charAt(lt + 1) == '!')) {
                pos = skipPast(lt, s.charAt(lt + 1) == '?' ? "?>" : ">");
                continue;
            }
            String gap = s.substring(textStart, lt);
            if (last == null) node.setHead(gap);
            else last.setTail(gap);

            if (lt + 1 < s.length() && s.charAt(lt + 1) == '/') {
                pos = lt + 2;
                String closing = parseName();
                if (!closing.equals(name))
                    throw malformed("expected </" + name + "> but found </" + closing + ">");
                int gt = s.indexOf('>', pos);
                if (gt < 0) throw malformed("unterminated end tag </" + name);
                pos = gt + 1;
                node.setCloseTag(s.substring(lt, pos));
                return node;
            }
            pos = lt;
            XmlNode child = parseElement();
            node.insertChild(node.children().size(), child);
            last = child;
            textStart = pos;
        }
    }

    private String parseName() {
        int start = pos;
        while (pos < s.length() && !isNameDelimiter(s.charAt(pos))) pos++;
        return s.substring(start, pos);
    }

    private static boolean isNameDelimiter(char c) {
        return Character.isWhitespace(c) || c == '/' || c == '>' || c == '=' || c == '<';
    }

    private void skipWs() {
        while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) pos++;
    }

    private int skipPast(int from, String terminator) {
        int end = s.indexOf(terminator, from + 1);
        if (end < 0) throw malformed("unterminated markup at offset " + from);
        return end + terminator.length();
    }

    private IllegalArgumentException malformed(String what) {
        return new IllegalArgumentException("Malformed XML at offset " + pos + ": " + what);
    }
}
