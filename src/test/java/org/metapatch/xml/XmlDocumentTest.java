package org.metapatch.xml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class XmlDocumentTest {

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private static byte[] withBom(byte[] bom, byte[] body) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(bom);
        out.writeBytes(body);
        return out.toByteArray();
    }

    @Test
    @DisplayName("UTF-8 BOM, mixed EOLs, comments and CDATA survive a load/save round trip")
    void roundTripsBytes(@TempDir Path dir) throws IOException {
        String xml = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\r\n"
                + "<!-- header -->\r\n"
                + "<DataCompositionSchema xmlns=\"http://v8.1c.ru/8.1/data-composition-system/schema\">\n"
                + "\t<dataSet>\r"
                + "\t\t<name>НаборДанных1</name>  <!-- trailing -->\n"
                + "\t\t<query><![CDATA[SELECT 1 < 2]]></query>\r\n"
                + "\t\t<empty   />\n"
                + "\t</dataSet>\n"
                + "</DataCompositionSchema>\r\n";
        byte[] bytes = withBom(UTF8_BOM, xml.getBytes(StandardCharsets.UTF_8));
        Path f = dir.resolve("Template.xml");
        Files.write(f, bytes);

        XmlDocument doc = XmlDocument.load(f);
        assertTrue(doc.hasByteOrderMark());
        assertEquals(StandardCharsets.UTF_8, doc.charset());
        assertEquals("\r\n", doc.lineEnding());
        assertFalse(doc.isModified());

        Path out = dir.resolve("copy.xml");
        doc.save(out);
        assertArrayEquals(bytes, Files.readAllBytes(out));
    }

    @Test
    @DisplayName("UTF-16LE documents keep their encoding")
    void roundTripsUtf16() {
        String xml = "<Rights>\r\n\t<object>\r\n\t\t<name>Catalog.Товары</name>\r\n\t</object>\r\n</Rights>";
        byte[] bytes = withBom(new byte[]{(byte) 0xFF, (byte) 0xFE}, xml.getBytes(StandardCharsets.UTF_16LE));

        XmlDocument doc = XmlDocument.load(bytes);
        assertEquals(StandardCharsets.UTF_16LE, doc.charset());
        assertEquals("Catalog.Товары", doc.find("Rights/object/name").text());
        assertArrayEquals(bytes, doc.toBytes());
    }

    @Test
    @DisplayName("Documents without a BOM are written without one")
    void keepsMissingBom() {
        byte[] bytes = "<root>\n\t<a x=\"1\"/>\n</root>\n".getBytes(StandardCharsets.UTF_8);
        XmlDocument doc = XmlDocument.load(bytes);

        assertFalse(doc.hasByteOrderMark());
        assertEquals("\n", doc.lineEnding());
        assertArrayEquals(bytes, doc.toBytes());
    }

    @Test
    @DisplayName("find walks element names from the root")
    void findsByPath() {
        XmlDocument doc = XmlDocument.load(
                "<a>\n\t<b>\n\t\t<c>x</c>\n\t</b>\n</a>".getBytes(StandardCharsets.UTF_8));

        assertEquals("x", doc.find("/a/b/c").text());
        assertEquals("x", doc.find("a/b/c").text());
        assertNull(doc.find("a/missing/c"));
        assertNull(doc.find("other/b"));
    }

    @Test
    @DisplayName("Attribute values and selectors resolve against parsed nodes")
    void selectsValues() {
        XmlDocument doc = XmlDocument.load(("<Form>\n\t<Attributes>\n\t\t<Attribute name=\"Items\" id=\"3\">\n"
                + "\t\t\t<Type>x</Type>\n\t\t</Attribute>\n\t</Attributes>\n</Form>").getBytes(StandardCharsets.UTF_8));
        XmlNode attributes = doc.find("Form/Attributes");

        assertEquals("Items", attributes.select("Attribute/@name"));
        assertEquals("x", attributes.select("Attribute/Type"));
        assertNull(attributes.select("Attribute/@missing"));
        assertEquals("", attributes.text());
    }

    @Test
    @DisplayName("Created documents start with a declaration and CRLF")
    void createsDocument() {
        XmlDocument doc = XmlDocument.create(XmlNode.element("Rights"));

        assertTrue(doc.isModified());
        assertTrue(doc.hasByteOrderMark());
        assertEquals("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\r\n<Rights></Rights>", doc.toXml());
    }

    @Test
    @DisplayName("Malformed input is rejected")
    void rejectsMalformed() {
        byte[] bytes = "<root>\n\t<a>\n</root>".getBytes(StandardCharsets.UTF_8);
        assertThrows(RuntimeException.class, () -> XmlDocument.load(bytes));
    }
}
