package org.metapatch.patch.service;

import org.metapatch.patch.config.PatchConfig;
import org.metapatch.patch.domain.AuditEntry;
import org.metapatch.patch.domain.AuditLog;
import org.metapatch.patch.domain.Outcome;
import org.metapatch.patch.domain.PatchRequest;
import org.metapatch.patch.domain.UsageException;
import org.metapatch.render.FragmentRenderer;
import org.metapatch.shorthand.ShorthandException;
import org.metapatch.shorthand.ShorthandParser;
import org.metapatch.xml.TargetNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs whole requests against files on disk with the real parser, renderer, editor and handlers.
 */
@DisplayName("PatchService Tests")
class PatchServiceTest {

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final UUID SETTING_ID = UUID.fromString("0b7e3c55-5d1f-4b6e-9a43-2f1c8e6d7a90");

    private static final String SCHEMA_HEAD = ""
            + "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
            + "<DataCompositionSchema xmlns=\"http://v8.1c.ru/8.1/data-composition-system/schema\" "
            + "xmlns:dcscom=\"http://v8.1c.ru/8.1/data-composition-system/common\" "
            + "xmlns:dcscor=\"http://v8.1c.ru/8.1/data-composition-system/core\" "
            + "xmlns:dcsset=\"http://v8.1c.ru/8.1/data-composition-system/settings\" "
            + "xmlns:v8=\"http://v8.1c.ru/8.1/data/core\" "
            + "xmlns:xs=\"http://www.w3.org/2001/XMLSchema\" "
            + "xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\">\n";

    private static final String DATA_SOURCE = ""
            + "\t<dataSource>\n"
            + "\t\t<name>ИсточникДанных1</name>\n"
            + "\t\t<dataSourceType>Local</dataSourceType>\n"
            + "\t</dataSource>\n";

    private static final String SCHEMA = SCHEMA_HEAD + DATA_SOURCE
            + "\t<dataSet xsi:type=\"DataSetQuery\">\n"
            + "\t\t<name>НаборДанных1</name>\n"
            + "\t\t<field xsi:type=\"DataSetFieldField\">\n"
            + "\t\t\t<dataPath>Customer</dataPath>\n"
            + "\t\t\t<field>Customer</field>\n"
            + "\t\t</field>\n"
            + "\t\t<dataSource>ИсточникДанных1</dataSource>\n"
            + "\t\t<query>SELECT 1</query>\n"
            + "\t</dataSet>\n"
            + "\t<totalField>\n"
            + "\t\t<dataPath>Amount</dataPath>\n"
            + "\t\t<expression>Sum(Amount)</expression>\n"
            + "\t</totalField>\n"
            + "\t<settingsVariant>\n"
            + "\t\t<dcsset:name>Основной</dcsset:name>\n"
            + "\t\t<dcsset:presentation xsi:type=\"xs:string\">Основной</dcsset:presentation>\n"
            + "\t\t<dcsset:settings>\n"
            + "\t\t\t<dcsset:selection>\n"
            + "\t\t\t\t<dcsset:item xsi:type=\"dcsset:SelectedItemField\">\n"
            + "\t\t\t\t\t<dcsset:field>Customer</dcsset:field>\n"
            + "\t\t\t\t</dcsset:item>\n"
            + "\t\t\t</dcsset:selection>\n"
            + "\t\t\t<dcsset:order>\n"
            + "\t\t\t\t<dcsset:item xsi:type=\"dcsset:OrderItemField\">\n"
            + "\t\t\t\t\t<dcsset:field>Customer</dcsset:field>\n"
            + "\t\t\t\t\t<dcsset:orderType>Asc</dcsset:orderType>\n"
            + "\t\t\t\t</dcsset:item>\n"
            + "\t\t\t</dcsset:order>\n"
            + "\t\t</dcsset:settings>\n"
            + "\t</settingsVariant>\n"
            + "</DataCompositionSchema>\n";

    @TempDir
    Path dir;

    private PatchConfig config;
    private PatchService service;

    @BeforeEach
    void setUp() {
        config = new PatchConfig();
        rebuild();
    }

    private void rebuild() {
        ShorthandParser parser = new ShorthandParser(config.getDefaultLanguage());
        FragmentRenderer renderer = new FragmentRenderer(config.getDefaultLanguage(), () -> SETTING_ID);
        service = new PatchService(new DocumentStore(config), renderer, config, List.of(
                new DcsOperationHandler(parser, config),
                new FormOperationHandler(parser),
                new RoleOperationHandler(parser),
                new ConfigurationOperationHandler(parser, config)));
    }

    private Path write(String name, String xml, boolean bom) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (bom) out.writeBytes(UTF8_BOM);
        out.writeBytes(xml.getBytes(StandardCharsets.UTF_8));
        Path file = dir.resolve(name);
        Files.write(file, out.toByteArray());
        return file;
    }

    private AuditLog run(String... args) throws IOException {
        return service.execute(PatchRequest.parse(args, config.getBatchSeparator()));
    }

    private static String read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        int offset = bytes.length >= 3 && bytes[0] == UTF8_BOM[0] && bytes[1] == UTF8_BOM[1]
                && bytes[2] == UTF8_BOM[2] ? 3 : 0;
        return new String(bytes, offset, bytes.length - offset, StandardCharsets.UTF_8);
    }

    private static List<String> lines(AuditLog audit) {
        return audit.entries().stream().map(AuditEntry::toLine).toList();
    }

    @Nested
    @DisplayName("Data composition schema")
    class Schema {

        @Test
        @DisplayName("Batch add-field inserts in canonical position, skips duplicates and cascades to the selection")
        void addFieldBatch() throws IOException {
            Path file = write("Template.xml", SCHEMA, true);

            AuditLog audit = run("add-field", file.toString(),
                    "Total: decimal(15,2) [Total Amount] @measure;;Customer: CatalogRef.Customers");

            String field = ""
                    + "\t\t<field xsi:type=\"DataSetFieldField\">\n"
                    + "\t\t\t<dataPath>Total</dataPath>\n"
                    + "\t\t\t<field>Total</field>\n"
                    + "\t\t\t<title xsi:type=\"v8:LocalStringType\">\n"
                    + "\t\t\t\t<v8:item>\n"
                    + "\t\t\t\t\t<v8:lang>ru</v8:lang>\n"
                    + "\t\t\t\t\t<v8:content>Total Amount</v8:content>\n"
                    + "\t\t\t\t</v8:item>\n"
                    + "\t\t\t</title>\n"
                    + "\t\t\t<role>\n"
                    + "\t\t\t\t<dcscom:measure>true</dcscom:measure>\n"
                    + "\t\t\t</role>\n"
                    + "\t\t\t<valueType>\n"
                    + "\t\t\t\t<v8:Type>xs:decimal</v8:Type>\n"
                    + "\t\t\t\t<v8:NumberQualifiers>\n"
                    + "\t\t\t\t\t<v8:Digits>15</v8:Digits>\n"
                    + "\t\t\t\t\t<v8:FractionDigits>2</v8:FractionDigits>\n"
                    + "\t\t\t\t\t<v8:AllowedSign>Any</v8:AllowedSign>\n"
                    + "\t\t\t\t</v8:NumberQualifiers>\n"
                    + "\t\t\t</valueType>\n"
                    + "\t\t</field>\n";
            String selection = ""
                    + "\t\t\t\t<dcsset:item xsi:type=\"dcsset:SelectedItemField\">\n"
                    + "\t\t\t\t\t<dcsset:field>Total</dcsset:field>\n"
                    + "\t\t\t\t</dcsset:item>\n";
            String expected = SCHEMA
                    .replace("\t\t\t<field>Customer</field>\n\t\t</field>\n",
                            "\t\t\t<field>Customer</field>\n\t\t</field>\n" + field)
                    .replace("\t\t\t\t</dcsset:item>\n\t\t\t</dcsset:selection>\n",
                            "\t\t\t\t</dcsset:item>\n" + selection + "\t\t\t</dcsset:selection>\n");

            assertEquals(expected, read(file));
            assertTrue(Files.readAllBytes(file)[0] == UTF8_BOM[0], "BOM kept");
            assertEquals(List.of("[ADDED] field Total", "[ADDED] selection Total",
                    "[SKIPPED] field Customer: already exists"), lines(audit));
        }

        @Test
        @DisplayName("--no-cascade leaves the variant alone")
        void noCascade() throws IOException {
            Path file = write("Template.xml", SCHEMA, false);

            AuditLog audit = run("add-field", file.toString(), "Total", "--no-cascade");

            assertEquals(1, audit.count(Outcome.ADDED));
            assertFalse(read(file).contains("<dcsset:field>Total</dcsset:field>"));
        }

        @Test
        @DisplayName("A filter without a variant creates the default variant")
        void filterCreatesVariant() throws IOException {
            String bare = SCHEMA_HEAD + DATA_SOURCE + "</DataCompositionSchema>\n";
            Path file = write("Template.xml", bare, false);

            AuditLog audit = run("add-filter", file.toString(), "Status = Active @user");

            String xml = read(file);
            assertTrue(xml.contains("<dcsset:name>Основной</dcsset:name>"), xml);
            assertTrue(xml.contains("\t\t\t<dcsset:filter>\n\t\t\t\t<dcsset:item xsi:type=\"dcsset:FilterItemComparison\">"),
                    xml);
            assertTrue(xml.contains("<dcsset:userSettingID>" + SETTING_ID + "</dcsset:userSettingID>"));
            assertTrue(xml.indexOf("</dataSource>") < xml.indexOf("<settingsVariant>"));
            assertEquals(List.of("[ADDED] variant Основной", "[ADDED] filter Status"), lines(audit));
        }

        @Test
        @DisplayName("A field in a schema without datasets creates the default dataset and data source")
        void fieldCreatesDataset() throws IOException {
            Path file = write("Template.xml", SCHEMA_HEAD + "</DataCompositionSchema>\n", false);

            AuditLog audit = run("add-field", file.toString(), "Total");

            String xml = read(file);
            assertTrue(xml.contains("<dataSource>\n\t\t<name>ИсточникДанных1</name>"), xml);
            assertTrue(xml.contains("<name>НаборДанных1</name>"));
            assertTrue(xml.indexOf("<dataSource>") < xml.indexOf("<dataSet"));
            assertEquals(List.of("[ADDED] dataset НаборДанных1", "[ADDED] data source ИсточникДанных1",
                    "[ADDED] field Total"), lines(audit));
        }

        @Test
        @DisplayName("Totals, parameters and variants go to the root in canonical order")
        void rootEntities() throws IOException {
            Path file = write("Template.xml", SCHEMA, false);

            run("add-parameter", file.toString(), "Period: StandardPeriod");
            run("add-total", file.toString(), "Total: Sum");

            String xml = read(file);
            assertTrue(xml.indexOf("<dataPath>Amount</dataPath>") < xml.indexOf("<dataPath>Total</dataPath>"));
            assertTrue(xml.indexOf("<dataPath>Total</dataPath>") < xml.indexOf("<name>Period</name>"));
            assertTrue(xml.indexOf("<name>Period</name>") < xml.indexOf("<settingsVariant>"));
        }

        @Test
        @DisplayName("Removing an absent field warns and leaves the file untouched")
        void removeAbsentField() throws IOException {
            Path file = write("Template.xml", SCHEMA, true);
            byte[] before = Files.readAllBytes(file);

            AuditLog audit = run("remove-field", file.toString(), "Missing");

            assertArrayEquals(before, Files.readAllBytes(file));
            assertEquals(List.of("[WARN] field Missing: not found"), lines(audit));
        }

        @Test
        @DisplayName("Removing a field restores the original text")
        void addThenRemove() throws IOException {
            Path file = write("Template.xml", SCHEMA, false);

            run("add-field", file.toString(), "Total: decimal(15,2)", "--no-cascade");
            run("remove-field", file.toString(), "total");

            assertEquals(SCHEMA, read(file));
        }

        @Test
        @DisplayName("A malformed entry aborts the whole batch before any edit")
        void malformedEntryAborts() throws IOException {
            Path file = write("Template.xml", SCHEMA, false);
            byte[] before = Files.readAllBytes(file);

            ShorthandException e = assertThrows(ShorthandException.class,
                    () -> run("add-field", file.toString(), "Total: decimal;;Price: strnig(10)"));

            assertEquals("string", e.getSuggestion());
            assertArrayEquals(before, Files.readAllBytes(file));
        }

        @Test
        @DisplayName("A missing target aborts and leaves the file untouched")
        void missingTarget() throws IOException {
            Path file = write("Template.xml", SCHEMA, false);
            byte[] before = Files.readAllBytes(file);

            assertThrows(TargetNotFoundException.class,
                    () -> run("add-field", file.toString(), "Total", "--target=Other"));
            assertThrows(TargetNotFoundException.class,
                    () -> run("add-order", file.toString(), "Total", "--target=Other"));
            assertArrayEquals(before, Files.readAllBytes(file));
        }

        @Test
        @DisplayName("Invalid bytes anywhere in the file abort the run instead of being rewritten")
        void invalidBytes() throws IOException {
            byte[] valid = SCHEMA.getBytes(StandardCharsets.UTF_8);
            int query = SCHEMA.substring(0, SCHEMA.indexOf("SELECT 1")).getBytes(StandardCharsets.UTF_8).length;
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            out.write(valid, 0, query);
            out.write(0xFF);
            out.write(valid, query, valid.length - query);
            Path file = dir.resolve("Template.xml");
            Files.write(file, out.toByteArray());
            byte[] before = Files.readAllBytes(file);

            IOException e = assertThrows(IOException.class, () -> run("add-field", file.toString(), "Total"));

            assertTrue(e.getMessage().contains(file.toString()), e.getMessage());
            assertArrayEquals(before, Files.readAllBytes(file));
        }

        @Test
        @DisplayName("set-query replaces the query text, set-expression the total expression")
        void modifications() throws IOException {
            Path file = write("Template.xml", SCHEMA, false);

            AuditLog query = run("set-query", file.toString(), "SELECT Customer FROM Catalog.Customers");
            AuditLog expression = run("set-expression", file.toString(), "Amount = Max(Amount)");
            AuditLog unchanged = run("set-expression", file.toString(), "Amount = Max(Amount)");

            String xml = read(file);
            assertTrue(xml.contains("<query>SELECT Customer FROM Catalog.Customers</query>"));
            assertTrue(xml.contains("<expression>Max(Amount)</expression>"));
            assertEquals(1, query.count(Outcome.MODIFIED));
            assertEquals(List.of("[MODIFIED] total Amount: expression replaced"), lines(expression));
            assertEquals(1, unchanged.count(Outcome.SKIPPED));
            assertThrows(TargetNotFoundException.class,
                    () -> run("set-expression", file.toString(), "Missing = 1"));
        }

        @Test
        @DisplayName("Order items are added, removed and cleared in the variant")
        void orderLifecycle() throws IOException {
            Path file = write("Template.xml", SCHEMA, false);

            run("add-order", file.toString(), "Amount desc;;Customer");
            String added = read(file);
            assertTrue(added.contains("<dcsset:field>Amount</dcsset:field>\n\t\t\t\t\t<dcsset:orderType>Desc"));

            AuditLog removed = run("remove-order", file.toString(), "Amount");
            assertEquals(1, removed.count(Outcome.REMOVED));
            assertEquals(SCHEMA, read(file));

            AuditLog cleared = run("clear-order", file.toString());
            assertEquals(List.of("[MODIFIED] order dcsset:order: 1 entries cleared"), lines(cleared));
            assertTrue(read(file).contains("\t\t\t<dcsset:order/>\n"));

            AuditLog again = run("clear-filter", file.toString());
            assertEquals(1, again.count(Outcome.SKIPPED));
        }

        @Test
        @DisplayName("A calculated field lands between datasets and totals and joins the selection")
        void calculatedField() throws IOException {
            Path file = write("Template.xml", SCHEMA, false);

            AuditLog audit = run("add-calculated-field", file.toString(), "Margin: decimal(15,2) = Revenue - Cost");

            assertEquals(2, audit.count(Outcome.ADDED));
            String xml = read(file);
            int calculated = xml.indexOf("<calculatedField>");
            assertTrue(calculated > xml.indexOf("</dataSet>"), xml);
            assertTrue(calculated < xml.indexOf("<totalField>"), xml);
            assertTrue(xml.contains("\t\t\t\t\t<dcsset:field>Margin</dcsset:field>\n"), xml);

            AuditLog removed = run("remove-calculated-field", file.toString(), "margin");
            assertEquals(1, removed.count(Outcome.REMOVED));
            assertFalse(read(file).contains("<calculatedField>"));
        }

        @Test
        @DisplayName("Selection entries are removed one by one or cleared together")
        void selectionLifecycle() throws IOException {
            Path file = write("Template.xml", SCHEMA, false);

            run("add-selection", file.toString(), "Amount");
            assertEquals(2, read(file).split("SelectedItemField", -1).length - 1);

            AuditLog removed = run("remove-selection", file.toString(), "Customer");
            assertEquals(1, removed.count(Outcome.REMOVED));
            assertEquals(1, read(file).split("SelectedItemField", -1).length - 1);

            AuditLog cleared = run("clear-selection", file.toString());
            assertEquals(1, cleared.count(Outcome.MODIFIED));
            assertTrue(read(file).contains("\t\t\t<dcsset:selection/>\n"));
        }

        @Test
        @DisplayName("Variants are appended after existing ones and removed by name")
        void variantLifecycle() throws IOException {
            Path file = write("Template.xml", SCHEMA, false);

            AuditLog audit = run("add-variant", file.toString(), "Extra [Дополнительный]");

            assertEquals(1, audit.count(Outcome.ADDED));
            String xml = read(file);
            assertTrue(xml.indexOf("<dcsset:name>Extra</dcsset:name>") > xml.indexOf("<dcsset:name>Основной</dcsset:name>"));

            assertEquals(1, run("add-variant", file.toString(), "extra").count(Outcome.SKIPPED));
            assertEquals(1, run("remove-variant", file.toString(), "Extra").count(Outcome.REMOVED));
            assertFalse(read(file).contains("Extra"));
        }

        @Test
        @DisplayName("Conditional appearance goes after the order list of the variant")
        void conditionalAppearance() throws IOException {
            Path file = write("Template.xml", SCHEMA, false);

            AuditLog audit = run("add-conditional-appearance", file.toString(),
                    "TextColor = style:NegativeTextColor when Amount < 0 for Amount");

            assertEquals(1, audit.count(Outcome.ADDED));
            String xml = read(file);
            int appearance = xml.indexOf("<dcsset:conditionalAppearance>");
            assertTrue(appearance > xml.indexOf("</dcsset:order>"), xml);
            assertTrue(appearance < xml.indexOf("</dcsset:settings>"), xml);
        }

        @Test
        @DisplayName("Clearing a settings list keeps its view mode")
        void clearKeepsListSettings() throws IOException {
            String schema = SCHEMA.replace("\t\t\t</dcsset:order>",
                    "\t\t\t\t<dcsset:viewMode>Normal</dcsset:viewMode>\n\t\t\t</dcsset:order>");
            Path file = write("Template.xml", schema, false);

            AuditLog cleared = run("clear-order", file.toString());

            assertEquals(List.of("[MODIFIED] order dcsset:order: 1 entries cleared"), lines(cleared));
            assertTrue(read(file).contains("\t\t\t<dcsset:order>\n\t\t\t\t<dcsset:viewMode>Normal</dcsset:viewMode>\n"
                    + "\t\t\t</dcsset:order>\n"), read(file));
            assertEquals(1, run("clear-order", file.toString()).count(Outcome.SKIPPED));
        }

        @Test
        @DisplayName("A new dataset gets the schema's data source")
        void addDataset() throws IOException {
            Path file = write("Template.xml", SCHEMA, false);

            run("add-dataset", file.toString(), "Stock: object");

            String xml = read(file);
            assertTrue(xml.contains("<name>Stock</name>\n\t\t<dataSource>ИсточникДанных1</dataSource>\n"
                    + "\t\t<objectName>Stock</objectName>"), xml);
            assertEquals(1, xml.split("<dataSourceType>", -1).length - 1);
        }

        @Test
        @DisplayName("Links to unknown datasets are added with a warning")
        void addLink() throws IOException {
            Path file = write("Template.xml", SCHEMA, false);

            AuditLog audit = run("add-link", file.toString(), "НаборДанных1 > Goods on Ref = Owner");

            assertEquals(1, audit.count(Outcome.WARN));
            assertEquals(1, audit.count(Outcome.ADDED));
            String xml = read(file);
            assertTrue(xml.indexOf("</dataSet>") < xml.indexOf("<dataSetLink>"));
            assertTrue(xml.indexOf("<dataSetLink>") < xml.indexOf("<totalField>"));
        }

        @Test
        @DisplayName("Schema operations refuse other dialects")
        void dialectMismatch() throws IOException {
            Path file = write("Rights.xml", "<Rights>\n</Rights>\n", false);
            assertThrows(UsageException.class, () -> run("add-field", file.toString(), "Total"));
        }
    }

    @Nested
    @DisplayName("Managed form")
    class Form {

        private static final String FORM = ""
                + "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\r\n"
                + "<Form xmlns=\"http://v8.1c.ru/8.3/xcf/logform\" xmlns:cfg=\"http://v8.1c.ru/8.1/data/enterprise/current-config\" "
                + "xmlns:v8=\"http://v8.1c.ru/8.1/data/core\" version=\"2.17\">\r\n"
                + "\t<ChildItems>\r\n"
                + "\t\t<Table name=\"Items\" id=\"1\">\r\n"
                + "\t\t\t<DataPath>Items</DataPath>\r\n"
                + "\t\t\t<ContextMenu name=\"ItemsКонтекстноеМеню\" id=\"2\"/>\r\n"
                + "\t\t\t<ChildItems>\r\n"
                + "\t\t\t\t<InputField name=\"ItemsCode\" id=\"4\">\r\n"
                + "\t\t\t\t\t<DataPath>Items.Code</DataPath>\r\n"
                + "\t\t\t\t</InputField>\r\n"
                + "\t\t\t</ChildItems>\r\n"
                + "\t\t</Table>\r\n"
                + "\t</ChildItems>\r\n"
                + "\t<Attributes>\r\n"
                + "\t\t<Attribute name=\"Items\" id=\"1\">\r\n"
                + "\t\t\t<Type>\r\n"
                + "\t\t\t\t<v8:Type>v8:ValueTable</v8:Type>\r\n"
                + "\t\t\t</Type>\r\n"
                + "\t\t\t<Columns>\r\n"
                + "\t\t\t\t<Column name=\"Code\" id=\"1\"/>\r\n"
                + "\t\t\t</Columns>\r\n"
                + "\t\t</Attribute>\r\n"
                + "\t</Attributes>\r\n"
                + "</Form>";

        @Test
        @DisplayName("add-column allocates fresh ids and adds the typed attribute column")
        void addColumn() throws IOException {
            Path file = write("Form.xml", FORM, true);

            AuditLog audit = run("add-column", file.toString(), "Price: decimal(15,2) [Цена]");

            String xml = read(file);
            assertTrue(xml.contains("\t\t\t\t</InputField>\r\n\t\t\t\t<InputField name=\"ItemsPrice\" id=\"5\">\r\n"
                    + "\t\t\t\t\t<DataPath>Items.Price</DataPath>\r\n"), xml);
            assertTrue(xml.contains("<ContextMenu name=\"ItemsPriceКонтекстноеМеню\" id=\"6\"/>"));
            assertTrue(xml.contains("<ExtendedTooltip name=\"ItemsPriceРасширеннаяПодсказка\" id=\"7\"/>"));
            assertTrue(xml.contains("\t\t\t\t<Column name=\"Code\" id=\"1\"/>\r\n\t\t\t\t<Column name=\"Price\" id=\"2\">"),
                    xml);
            assertTrue(xml.endsWith("</Form>"));
            assertEquals(List.of("[ADDED] column Price", "[ADDED] attribute column Price"), lines(audit));
        }

        @Test
        @DisplayName("remove-column also drops the attribute column")
        void removeColumn() throws IOException {
            Path file = write("Form.xml", FORM, false);

            AuditLog audit = run("remove-column", file.toString(), "Code");

            String xml = read(file);
            assertFalse(xml.contains("ItemsCode"));
            assertFalse(xml.contains("<Column name=\"Code\""));
            assertTrue(xml.contains("\t\t\t<ChildItems>\r\n\t\t\t</ChildItems>"), xml);
            assertEquals(List.of("[REMOVED] column Code", "[REMOVED] attribute column Code"), lines(audit));
        }

        @Test
        @DisplayName("Unknown tables are fatal")
        void unknownTable() throws IOException {
            Path file = write("Form.xml", FORM, false);
            assertThrows(TargetNotFoundException.class,
                    () -> run("add-column", file.toString(), "Price", "--target=Goods"));
        }
    }

    @Nested
    @DisplayName("Role rights")
    class Role {

        private static final String RIGHTS = ""
                + "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<Rights xmlns=\"http://v8.1c.ru/8.2/roles\" version=\"2.17\">\n"
                + "\t<setForNewObjects>false</setForNewObjects>\n"
                + "\t<setForAttributesByDefault>true</setForAttributesByDefault>\n"
                + "\t<independentRightsOfChildObjects>false</independentRightsOfChildObjects>\n"
                + "\t<object>\n"
                + "\t\t<name>Catalog.Products</name>\n"
                + "\t\t<right>\n"
                + "\t\t\t<name>Read</name>\n"
                + "\t\t\t<value>true</value>\n"
                + "\t\t</right>\n"
                + "\t</object>\n"
                + "</Rights>\n";

        @Test
        @DisplayName("New objects are appended after the existing ones")
        void addsObject() throws IOException {
            Path file = write("Rights.xml", RIGHTS, false);

            run("add-right", file.toString(), "Document.Orders: Read Posting");

            assertEquals(RIGHTS.replace("\t</object>\n</Rights>", "\t</object>\n"
                    + "\t<object>\n"
                    + "\t\t<name>Document.Orders</name>\n"
                    + "\t\t<right>\n\t\t\t<name>Read</name>\n\t\t\t<value>true</value>\n\t\t</right>\n"
                    + "\t\t<right>\n\t\t\t<name>Posting</name>\n\t\t\t<value>true</value>\n\t\t</right>\n"
                    + "\t</object>\n</Rights>"), read(file));
        }

        @Test
        @DisplayName("Rights on an existing object are merged")
        void mergesRights() throws IOException {
            Path file = write("Rights.xml", RIGHTS, false);

            AuditLog merged = run("add-right", file.toString(), "Catalog.Products: Read View");
            AuditLog again = run("add-right", file.toString(), "Catalog.Products: read view");

            String xml = read(file);
            assertTrue(xml.contains("\t\t</right>\n\t\t<right>\n\t\t\t<name>View</name>\n\t\t\t<value>true</value>\n"
                    + "\t\t</right>\n\t</object>"), xml);
            assertEquals(1, merged.count(Outcome.MODIFIED));
            assertEquals(List.of("[SKIPPED] right Catalog.Products: Read View: already granted"), lines(again));
        }

        @Test
        @DisplayName("remove-right drops listed rights or the whole object")
        void removesRights() throws IOException {
            Path file = write("Rights.xml", RIGHTS, false);

            run("remove-right", file.toString(), "Catalog.Products: Read");
            assertTrue(read(file).contains("\t\t<name>Catalog.Products</name>\n\t</object>"));

            run("remove-right", file.toString(), "Catalog.Products");
            assertFalse(read(file).contains("Catalog.Products"));
            assertTrue(read(file).endsWith("</independentRightsOfChildObjects>\n</Rights>\n"));
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        private static final String CONFIGURATION = ""
                + "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<MetaDataObject xmlns=\"http://v8.1c.ru/8.3/MDClasses\" version=\"2.17\">\n"
                + "\t<Configuration uuid=\"8b1a6c44-0000-0000-0000-000000000000\">\n"
                + "\t\t<Properties>\n"
                + "\t\t\t<Name>Demo</Name>\n"
                + "\t\t</Properties>\n"
                + "\t\t<ChildObjects>\n"
                + "\t\t\t<Language>Русский</Language>\n"
                + "\t\t\t<Catalog>Products</Catalog>\n"
                + "\t\t\t<Document>Orders</Document>\n"
                + "\t\t</ChildObjects>\n"
                + "\t</Configuration>\n"
                + "</MetaDataObject>\n";

        @Test
        @DisplayName("Objects are registered after the last one of their kind")
        void addsObject() throws IOException {
            Path file = write("Configuration.xml", CONFIGURATION, false);

            AuditLog audit = run("add-object", file.toString(), "Справочник.Customers;;Catalog.products");

            assertEquals(CONFIGURATION.replace("\t\t\t<Catalog>Products</Catalog>\n",
                    "\t\t\t<Catalog>Products</Catalog>\n\t\t\t<Catalog>Customers</Catalog>\n"), read(file));
            assertEquals(List.of("[ADDED] object Catalog.Customers",
                    "[SKIPPED] object Catalog.products: already exists"), lines(audit));
        }

        @Test
        @DisplayName("Sorting by name places objects alphabetically within their kind")
        void sortsByName() throws IOException {
            config.getConfiguration().setSortObjectsByName(true);
            rebuild();
            Path file = write("Configuration.xml", CONFIGURATION, false);

            run("add-object", file.toString(), "Catalog.Customers");

            assertTrue(read(file).contains("\t\t\t<Catalog>Customers</Catalog>\n\t\t\t<Catalog>Products</Catalog>\n"));
        }

        @Test
        @DisplayName("Objects are unregistered by kind and name")
        void removesObject() throws IOException {
            Path file = write("Configuration.xml", CONFIGURATION, false);

            AuditLog audit = run("remove-object", file.toString(), "Document.Orders");

            assertFalse(read(file).contains("<Document>"));
            assertEquals(List.of("[REMOVED] object Document.Orders"), lines(audit));
        }
    }
}
