package org.metapatch.patch.reporting;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.metapatch.patch.config.PatchConfig;
import org.metapatch.patch.domain.AuditLog;
import org.metapatch.patch.domain.PatchRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PatchReportServiceTest {

    @Mock
    private PatchConfig patchConfig;

    @Mock
    private PatchConfig.ReportConfig reportConfig;

    @TempDir
    Path tempDir;

    private PatchReportService service;
    private PatchRequest request;

    @BeforeEach
    void setUp() {
        when(patchConfig.getReport()).thenReturn(reportConfig);
        service = new PatchReportService(patchConfig);
        request = PatchRequest.parse(new String[]{"add-field", "Template.xml", "Total;;Customer"}, ";;");
    }

    private static AuditLog audit() {
        AuditLog audit = new AuditLog();
        audit.added("field", "Total");
        audit.skipped("field", "Customer", "already exists");
        audit.warn("Unexpected <foo> in /DataCompositionSchema skipped while ordering");
        return audit;
    }

    @Test
    void disabledByDefault() {
        when(reportConfig.isGenerateJunit()).thenReturn(false);
        when(reportConfig.isGenerateJson()).thenReturn(false);

        assertFalse(service.isEnabled());
    }

    @Test
    void buildsSummaryFromAudit() {
        PatchReportModels.PatchReport report = service.build(request, audit(), null);

        assertEquals("add-field", report.operation);
        assertEquals("data composition schema", report.dialect);
        assertEquals("Template.xml", report.document);
        assertTrue(report.written);
        assertEquals(1, report.summary.added);
        assertEquals(1, report.summary.skipped);
        assertEquals(1, report.summary.warnings);
        assertEquals(3, report.entries.size());
        assertEquals("SKIPPED", report.entries.get(1).outcome);
        assertNull(report.entries.get(2).kind);
        assertFalse(report.isPassing());
    }

    @Test
    void abortedBatchHasOnlyTheError() {
        PatchReportModels.PatchReport report = service.build(request, null, "Unknown type: 'strnig'");

        assertFalse(report.written);
        assertNull(report.summary);
        assertTrue(report.entries.isEmpty());
        assertFalse(report.isPassing());
    }

    @Test
    void writesAllFormats() throws Exception {
        when(reportConfig.getOutputDirectory()).thenReturn(tempDir.toString());
        when(reportConfig.isGenerateJunit()).thenReturn(true);
        when(reportConfig.isGenerateJson()).thenReturn(true);
        when(reportConfig.getJunitSubdirectory()).thenReturn("junit");
        when(reportConfig.getJsonSubdirectory()).thenReturn("json");
        when(reportConfig.getJunitFileName()).thenReturn("TEST-patch-report.xml");
        when(reportConfig.getJsonFileName()).thenReturn("patch-report.json");
        when(reportConfig.getJunitSuiteName()).thenReturn("MetadataPatch");

        service.writeAll(service.build(request, audit(), null));

        File junit = new File(tempDir.toFile(), "junit/TEST-patch-report.xml");
        File json = new File(tempDir.toFile(), "json/patch-report.json");
        assertTrue(junit.exists());
        assertTrue(json.exists());

        String xml = Files.readString(junit.toPath(), StandardCharsets.UTF_8);
        assertTrue(xml.contains("tests=\"3\""), xml);
        assertTrue(xml.contains("failures=\"1\""));
        assertTrue(xml.contains("skipped=\"1\""));
        assertTrue(xml.contains("name=\"field Total\""));

        JsonNode tree = new ObjectMapper().readTree(json);
        assertEquals("add-field", tree.get("operation").asText());
        assertEquals(1, tree.get("summary").get("added").asInt());
        assertNotNull(tree.get("generatedAt"));
        assertNull(tree.get("error"));
    }

    @Test
    void writesErrorCaseToJunit() throws Exception {
        when(reportConfig.getOutputDirectory()).thenReturn(tempDir.toString());
        when(reportConfig.isGenerateJunit()).thenReturn(true);
        when(reportConfig.isGenerateJson()).thenReturn(false);
        when(reportConfig.getJunitSubdirectory()).thenReturn("junit");
        when(reportConfig.getJunitFileName()).thenReturn("TEST-patch-report.xml");
        when(reportConfig.getJunitSuiteName()).thenReturn("MetadataPatch");

        service.writeAll(service.build(request, null, "Document not found: Template.xml"));

        String xml = Files.readString(tempDir.resolve("junit/TEST-patch-report.xml"), StandardCharsets.UTF_8);
        assertTrue(xml.contains("errors=\"1\""), xml);
        assertTrue(xml.contains("Document not found"));
        assertFalse(Files.exists(tempDir.resolve("json")));
    }
}
