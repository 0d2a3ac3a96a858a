package org.metapatch.patch.reporting;

import org.metapatch.patch.config.PatchConfig;
import org.metapatch.patch.domain.AuditEntry;
import org.metapatch.patch.domain.AuditLog;
import org.metapatch.patch.domain.Outcome;
import org.metapatch.patch.domain.PatchRequest;
import org.springframework.stereotype.Service;

import java.io.File;
import java.time.LocalDateTime;
import java.util.ArrayList;

@Service
public class PatchReportService {

    private final PatchConfig.ReportConfig reportConfig;
    private final JUnitPatchReportWriter junitWriter = new JUnitPatchReportWriter();
    private final JsonPatchReportWriter jsonWriter = new JsonPatchReportWriter();

    public PatchReportService(PatchConfig patchConfig) {
        this.reportConfig = patchConfig.getReport();
    }

    public boolean isEnabled() {
        return reportConfig.isGenerateJunit() || reportConfig.isGenerateJson();
    }

    /** Builds the report of a finished (or, with {@code error} set, aborted) invocation. */
    public PatchReportModels.PatchReport build(PatchRequest request, AuditLog audit, String error) {
        PatchReportModels.PatchReport report = new PatchReportModels.PatchReport();
        report.title = "Metadata Patch Report";
        report.document = request.document().toString();
        report.operation = request.operation().cliName();
        report.dialect = request.operation().dialect().description();
        report.error = error;
        report.entries = new ArrayList<>();
        if (audit != null) {
            report.written = audit.hasChanges();
            PatchReportModels.Summary summary = new PatchReportModels.Summary();
            summary.added = audit.count(Outcome.ADDED);
            summary.removed = audit.count(Outcome.REMOVED);
            summary.modified = audit.count(Outcome.MODIFIED);
            summary.skipped = audit.count(Outcome.SKIPPED);
            summary.warnings = audit.count(Outcome.WARN);
            report.summary = summary;
            for (AuditEntry entry : audit.entries()) {
                PatchReportModels.EntryRow row = new PatchReportModels.EntryRow();
                row.outcome = entry.outcome().name();
                row.kind = entry.kind();
                row.name = entry.name();
                row.message = entry.message();
                report.entries.add(row);
            }
        }
        return report;
    }

    public void writeAll(PatchReportModels.PatchReport report) {
        report.generatedAt = LocalDateTime.now();
        File baseDir = new File(reportConfig.getOutputDirectory());

        if (reportConfig.isGenerateJunit()) {
            File dir = new File(baseDir, reportConfig.getJunitSubdirectory());
            junitWriter.write(dir, reportConfig.getJunitSuiteName(), report, reportConfig.getJunitFileName());
        }
        if (reportConfig.isGenerateJson()) {
            File dir = new File(baseDir, reportConfig.getJsonSubdirectory());
            jsonWriter.write(dir, report, reportConfig.getJsonFileName());
        }
    }
}
