package org.metapatch.xml;

/**
 * Escaping and gap helpers shared by the parser, the tree and the editor.
 */
public final class XmlText {

    private XmlText() {
    }

    public static String escape(String text) {
        if (text == null) return "";
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String escapeAttribute(String value) {
        return escape(value).replace("\"", "&quot;");
    }

    /**
     * Decodes raw element content: entities are resolved, CDATA sections are unwrapped and comments dropped.
     */
    public static String decode(String raw) {
        if (raw == null || raw.isEmpty()) return "";
        StringBuilder sb = new StringBuilder(raw.length());
        int p = 0;
        while (p < raw.length()) {
            if (raw.startsWith("<![CDATA[", p)) {
                int end = raw.indexOf("]]>", p);
                if (end < 0) end = raw.length();
                sb.append(raw, p + 9, end);
                p = Math.min(raw.length(), end + 3);
            } else if (raw.startsWith("<!--", p)) {
                int end = raw.indexOf("-->", p);
                p = end < 0 ? raw.length() : end + 3;
            } else if (raw.charAt(p) == '&') {
                int semi = raw.indexOf(';', p);
                if (semi < 0) {
                    sb.append('&');
                    p++;
                    continue;
                }
                sb.append(entity(raw.substring(p + 1, semi), raw.substring(p, semi + 1)));
                p = semi + 1;
            } else {
                sb.append(raw.charAt(p++));
            }
        }
        return sb.toString();
    }

    private static String entity(String name, String literal) {
        switch (name) {
            case "amp": return "&";
            case "lt": return "<";
            case "gt": return ">";
            case "quot": return "\"";
            case "apos": return "'";
            default:
                try {
                    if (name.startsWith("#x") || name.startsWith("#X"))
                        return new String(Character.toChars(Integer.parseInt(name.substring(2), 16)));
                    if (name.startsWith("#"))
                        return new String(Character.toChars(Integer.parseInt(name.substring(1))));
                } catch (IllegalArgumentException e) {
                    return literal;
                }
                return literal;
        }
    }

    /**
     * Returns the line break plus indentation that ends {@code gap} ("\r\n\t\t"), or {@code null} when the gap
     * does not end with a newline followed by blanks.
     */
    public static String trailingBreak(String gap) {
        if (gap == null || gap.isEmpty()) return null;
        int p = gap.length();
        while (p > 0 && (gap.charAt(p - 1) == ' ' || gap.charAt(p - 1) == '\t')) p--;
        if (p == 0) return null;
        char c = gap.charAt(p - 1);
        if (c == '\n') {
            p--;
            if (p > 0 && gap.charAt(p - 1) == '\r') p--;
            return gap.substring(p);
        }
        if (c == '\r') return gap.substring(p - 1);
        return null;
    }

    /** Indentation after the last newline of a line break, "" when there is none. */
    public static String indentOf(String lineBreak) {
        if (lineBreak == null) return "";
        int nl = Math.max(lineBreak.lastIndexOf('\n'), lineBreak.lastIndexOf('\r'));
        return lineBreak.substring(nl + 1);
    }

    public static String stripTrailingWhitespace(String gap) {
        if (gap == null) return "";
        int p = gap.length();
        while (p > 0 && Character.isWhitespace(gap.charAt(p - 1))) p--;
        return gap.substring(0, p);
    }

    public static boolean isBlank(String gap) {
        return gap == null || gap.isBlank();
    }
}
