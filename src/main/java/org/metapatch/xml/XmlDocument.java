package org.metapatch.xml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A loaded metadata document.
 * <p>
 * Features:
 * • BOM + UTF-8/UTF-16/legacy charset detection, the marker is written back as it was read.
 * • Prolog (declaration, leading comments) and epilogue kept verbatim.
 * • Mixed line endings preserved; the first line ending found is used for new content.
 * • Loading and saving with no edits in between reproduces the input bytes exactly.
 */
public final class XmlDocument {

    /** Line ending used for new content when the document has none (the platform writes CRLF). */
    public static final String DEFAULT_LINE_ENDING = "\r\n";

    private final DocumentEncoding encoding;
    private final String prolog;
    private final XmlNode root;
    private final String lineEnding;
    private boolean modified;

    private XmlDocument(DocumentEncoding encoding, String prolog, XmlNode root, String lineEnding) {
        this.encoding = encoding;
        this.prolog = prolog;
        this.root = root;
        this.lineEnding = lineEnding;
    }

    /* ===================== Load ===================== */

    public static XmlDocument load(byte[] bytes) {
        return load(bytes, null);
    }

    public static XmlDocument load(byte[] bytes, String encodingHint) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        DocumentEncoding info = DocumentEncoding.detect(bytes, encodingHint);
        String xml = info.decode(bytes);
        XmlTreeParser.Parsed parsed = new XmlTreeParser(xml).parse();
        return new XmlDocument(info, parsed.prolog(), parsed.root(), detectLineEnding(xml));
    }

    public static XmlDocument load(InputStream in, String encodingHint) throws IOException {
        return load(in.readAllBytes(), encodingHint);
    }

    public static XmlDocument load(Path file) throws IOException {
        return load(Files.readAllBytes(file), null);
    }

    /**
     * Creates a document around an empty root element; the starting point for generating a new file with the same
     * renderer and editor used for patches.
     */
    public static XmlDocument create(XmlNode root) {
        String declaration = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>" + DEFAULT_LINE_ENDING;
        XmlDocument doc = new XmlDocument(DocumentEncoding.platformDefault(), declaration, root, DEFAULT_LINE_ENDING);
        doc.modified = true;
        return doc;
    }

    private static String detectLineEnding(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r') return i + 1 < text.length() && text.charAt(i + 1) == '\n' ? "\r\n" : "\r";
            if (c == '\n') return "\n";
        }
        return DEFAULT_LINE_ENDING;
    }

    /* ===================== Save ===================== */

    public String toXml() {
        StringBuilder sb = new StringBuilder(prolog);
        root.write(sb);
        sb.append(root.tail());
        return sb.toString();
    }

    public byte[] toBytes() {
        return encoding.encode(toXml());
    }

    public void save(Path file) throws IOException {
        Files.write(file, toBytes());
    }

    /* ===================== Navigation ===================== */

    public XmlNode root() {
        return root;
    }

    /**
     * Finds the first element on a slash separated path of element names, starting with the root
     * ("DataCompositionSchema/dataSet/field"). A leading '/' is optional.
     */
    public XmlNode find(String path) {
        String p = path.startsWith("/") ? path.substring(1) : path;
        String[] steps = p.split("/");
        if (steps.length == 0 || !steps[0].equals(root.name())) return null;
        XmlNode current = root;
        for (int i = 1; i < steps.length && current != null; i++) {
            current = current.child(steps[i]);
        }
        return current;
    }

    public String lineEnding() {
        return lineEnding;
    }

    public Charset charset() {
        return encoding.cs;
    }

    public boolean hasByteOrderMark() {
        return encoding.offset > 0;
    }

    public boolean isModified() {
        return modified;
    }

    void markModified() {
        modified = true;
    }
}
