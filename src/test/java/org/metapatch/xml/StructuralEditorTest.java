package org.metapatch.xml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StructuralEditorTest {

    private static final OrderSpec ABC = OrderSpec.of("root", "a", "b", "c");

    private static XmlDocument doc(String xml) {
        return XmlDocument.load(xml.getBytes(StandardCharsets.UTF_8));
    }

    private static StructuralEditor editor(XmlDocument doc) {
        return new StructuralEditor(doc, IndentationInferencer.forDocument(doc, "\t"));
    }

    @Nested
    @DisplayName("insert")
    class Insert {

        @Test
        @DisplayName("Between two siblings in canonical order")
        void insertsInCanonicalPosition() {
            XmlDocument doc = doc("<root>\n\t<a>1</a>\n\t<c>3</c>\n</root>\n");
            editor(doc).insert(doc.root(), XmlNode.leaf("b", "2"), ABC, OrderKey.of("b"));

            assertEquals("<root>\n\t<a>1</a>\n\t<b>2</b>\n\t<c>3</c>\n</root>\n", doc.toXml());
            assertTrue(doc.isModified());
        }

        @Test
        @DisplayName("Appends after the last child without a key")
        void appendsAtEnd() {
            XmlDocument doc = doc("<root>\n\t<a>1</a>\n\t<c>3</c>\n</root>\n");
            editor(doc).append(doc.root(), XmlNode.leaf("b", "2"));

            assertEquals("<root>\n\t<a>1</a>\n\t<c>3</c>\n\t<b>2</b>\n</root>\n", doc.toXml());
        }

        @Test
        @DisplayName("Before the first child")
        void insertsFirst() {
            XmlDocument doc = doc("<root>\n\t<b>2</b>\n\t<c>3</c>\n</root>\n");
            editor(doc).insert(doc.root(), XmlNode.leaf("a", "1"), ABC, OrderKey.of("a"));

            assertEquals("<root>\n\t<a>1</a>\n\t<b>2</b>\n\t<c>3</c>\n</root>\n", doc.toXml());
        }

        @Test
        @DisplayName("Opens a self-closed container and indents one level deeper than it")
        void opensEmptyContainer() {
            XmlDocument doc = doc("<root>\n\t<list/>\n</root>\n");
            XmlNode list = doc.root().child("list");
            editor(doc).append(list, XmlNode.empty("item"));

            assertEquals("<root>\n\t<list>\n\t\t<item/>\n\t</list>\n</root>\n", doc.toXml());
        }

        @Test
        @DisplayName("Multi-line fragment is laid out at the insertion depth")
        void nestedFragment() {
            XmlDocument doc = doc("<root>\n\t<a>1</a>\n\t<c>3</c>\n</root>\n");
            XmlNode b = XmlNode.element("b").add(XmlNode.leaf("x", "1")).layout("\n\t", "\t");
            editor(doc).insert(doc.root(), b, ABC, OrderKey.of("b"));

            assertEquals("<root>\n\t<a>1</a>\n\t<b>\n\t\t<x>1</x>\n\t</b>\n\t<c>3</c>\n</root>\n", doc.toXml());
        }

        @Test
        @DisplayName("CRLF and two-space indentation are reused")
        void keepsCrlfAndSpaces() {
            XmlDocument doc = doc("<root>\r\n  <a/>\r\n</root>");
            editor(doc).append(doc.root(), XmlNode.empty("b"));

            assertEquals("<root>\r\n  <a/>\r\n  <b/>\r\n</root>", doc.toXml());
        }

        @Test
        @DisplayName("Same kind is ordered by display key when the order has one")
        void sortsByDisplayKey() {
            XmlDocument doc = doc("<ChildObjects>\n\t<Catalog>Alpha</Catalog>\n\t<Catalog>Gamma</Catalog>\n</ChildObjects>");
            OrderSpec spec = OrderSpec.of("ChildObjects", "Catalog").withDisplayKey(XmlNode::text);
            editor(doc).insert(doc.root(), XmlNode.leaf("Catalog", "Beta"), spec, OrderKey.of("Catalog", "Beta"));

            assertEquals("<ChildObjects>\n\t<Catalog>Alpha</Catalog>\n\t<Catalog>Beta</Catalog>\n"
                    + "\t<Catalog>Gamma</Catalog>\n</ChildObjects>", doc.toXml());
        }

        @Test
        @DisplayName("Unknown kinds are passed over with a warning")
        void warnsOnUnknownKind() {
            XmlDocument doc = doc("<root>\n\t<x/>\n\t<c/>\n</root>");
            StructuralEditor editor = editor(doc);
            editor.insert(doc.root(), XmlNode.empty("a"), ABC, OrderKey.of("a"));

            assertEquals("<root>\n\t<x/>\n\t<a/>\n\t<c/>\n</root>", doc.toXml());
            List<String> warnings = editor.drainWarnings();
            assertEquals(1, warnings.size());
            assertTrue(warnings.get(0).contains("<x>"));
            assertTrue(editor.drainWarnings().isEmpty());
        }

        @Test
        @DisplayName("Kind missing from the order is appended with a warning")
        void appendsUnorderedKind() {
            XmlDocument doc = doc("<root>\n\t<a/>\n\t<c/>\n</root>");
            StructuralEditor editor = editor(doc);
            editor.insert(doc.root(), XmlNode.empty("z"), ABC, OrderKey.of("z"));

            assertEquals("<root>\n\t<a/>\n\t<c/>\n\t<z/>\n</root>", doc.toXml());
            assertEquals(1, editor.drainWarnings().size());
        }

        @Test
        @DisplayName("Attached fragments are rejected")
        void rejectsAttachedFragment() {
            XmlDocument doc = doc("<root>\n\t<a/>\n</root>");
            XmlNode a = doc.root().child("a");
            assertThrows(IllegalArgumentException.class, () -> editor(doc).append(doc.root(), a));
        }
    }

    @Nested
    @DisplayName("remove")
    class Remove {

        @Test
        @DisplayName("Middle child takes its preceding gap with it")
        void removesMiddle() {
            XmlDocument doc = doc("<root>\n\t<a>1</a>\n\t<b>2</b>\n\t<c>3</c>\n</root>\n");
            editor(doc).remove(doc.root().child("b"));

            assertEquals("<root>\n\t<a>1</a>\n\t<c>3</c>\n</root>\n", doc.toXml());
        }

        @Test
        @DisplayName("First and last children")
        void removesEnds() {
            XmlDocument doc = doc("<root>\n\t<a>1</a>\n\t<b>2</b>\n\t<c>3</c>\n</root>\n");
            StructuralEditor editor = editor(doc);
            editor.remove(doc.root().child("a"));
            editor.remove(doc.root().child("c"));

            assertEquals("<root>\n\t<b>2</b>\n</root>\n", doc.toXml());
        }

        @Test
        @DisplayName("Comments in front of the removed node survive")
        void keepsComments() {
            XmlDocument doc = doc("<root>\n\t<a/>\n\t<!-- keep -->\n\t<b/>\n</root>");
            editor(doc).remove(doc.root().child("b"));

            assertEquals("<root>\n\t<a/>\n\t<!-- keep -->\n</root>", doc.toXml());
        }

        @Test
        @DisplayName("Insert then remove restores the original text")
        void insertRemoveIsIdentity() {
            String xml = "<root>\n\t<a>1</a>\n\t<c>3</c>\n</root>\n";
            XmlDocument doc = doc(xml);
            StructuralEditor editor = editor(doc);
            XmlNode b = editor.insert(doc.root(), XmlNode.leaf("b", "2"), ABC, OrderKey.of("b"));
            editor.remove(b);

            assertEquals(xml, doc.toXml());
        }

        @Test
        @DisplayName("The root cannot be removed")
        void rejectsRoot() {
            XmlDocument doc = doc("<root/>");
            assertThrows(IllegalArgumentException.class, () -> editor(doc).remove(doc.root()));
        }
    }

    @Nested
    @DisplayName("text and containers")
    class TextAndContainers {

        @Test
        @DisplayName("replaceText escapes markup and reports unchanged text")
        void replacesText() {
            XmlDocument doc = doc("<root>\n\t<q>old &amp; x</q>\n</root>");
            StructuralEditor editor = editor(doc);
            XmlNode q = doc.root().child("q");

            assertFalse(editor.replaceText(q, "old & x"));
            assertFalse(doc.isModified());
            assertTrue(editor.replaceText(q, "a < b"));
            assertEquals("<root>\n\t<q>a &lt; b</q>\n</root>", doc.toXml());
            assertEquals("a < b", q.text());
        }

        @Test
        @DisplayName("replaceText refuses elements with children")
        void replaceTextRejectsContainers() {
            XmlDocument doc = doc("<root>\n\t<a/>\n</root>");
            assertThrows(IllegalArgumentException.class, () -> editor(doc).replaceText(doc.root(), "x"));
        }

        @Test
        @DisplayName("clearChildren leaves a self-closed element")
        void clearsChildren() {
            XmlDocument doc = doc("<root>\n\t<list>\n\t\t<item/>\n\t\t<item/>\n\t</list>\n</root>");
            StructuralEditor editor = editor(doc);

            assertEquals(2, editor.clearChildren(doc.root().child("list")));
            assertEquals("<root>\n\t<list/>\n</root>", doc.toXml());
            assertEquals(0, editor.clearChildren(doc.root().child("list")));
        }

        @Test
        @DisplayName("clearChildren by name keeps the other children and their layout")
        void clearsNamedChildren() {
            XmlDocument doc = doc("<root>\n\t<list>\n\t\t<item/>\n\t\t<item/>\n\t\t<viewMode>Normal</viewMode>\n"
                    + "\t</list>\n</root>");
            StructuralEditor editor = editor(doc);

            assertEquals(2, editor.clearChildren(doc.root().child("list"), "item"));
            assertEquals("<root>\n\t<list>\n\t\t<viewMode>Normal</viewMode>\n\t</list>\n</root>", doc.toXml());
            assertEquals(0, editor.clearChildren(doc.root().child("list"), "item"));
        }

        @Test
        @DisplayName("ensureChild creates a missing container in canonical position")
        void ensuresChild() {
            XmlDocument doc = doc("<root>\n\t<a/>\n\t<c/>\n</root>");
            StructuralEditor editor = editor(doc);
            XmlNode b = editor.ensureChild(doc.root(), "b", ABC);

            assertSame(b, editor.ensureChild(doc.root(), "b", ABC));
            assertEquals("<root>\n\t<a/>\n\t<b/>\n\t<c/>\n</root>", doc.toXml());
        }
    }
}
