package org.metapatch.patch;

import org.metapatch.patch.config.PatchConfig;
import org.metapatch.patch.domain.AuditEntry;
import org.metapatch.patch.domain.AuditLog;
import org.metapatch.patch.domain.PatchRequest;
import org.metapatch.patch.domain.UsageException;
import org.metapatch.patch.reporting.PatchReportService;
import org.metapatch.patch.service.PatchService;
import org.metapatch.shorthand.ShorthandException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;

/**
 * Runs the request given on the command line and prints the audit. The exit code is 0 when every entry completed,
 * 2 for usage and shorthand errors, 1 for anything else that aborted the batch.
 */
@Component
public class PatchRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private static final Logger logger = LoggerFactory.getLogger(PatchRunner.class);

    private final PatchService patchService;
    private final PatchReportService reportService;
    private final PatchConfig config;
    private final PrintStream out;
    private int exitCode = OK;

    @Autowired
    public PatchRunner(PatchService patchService, PatchReportService reportService, PatchConfig config) {
        this(patchService, reportService, config, System.out);
    }

    PatchRunner(PatchService patchService, PatchReportService reportService, PatchConfig config, PrintStream out) {
        this.patchService = patchService;
        this.reportService = reportService;
        this.config = config;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        PatchRequest request;
        try {
            request = PatchRequest.parse(args, config.getBatchSeparator());
        } catch (UsageException e) {
            logger.error("Invalid command line: {}", e.getMessage());
            out.println("error: " + e.getMessage());
            exitCode = USAGE;
            return;
        }

        AuditLog audit = null;
        String error = null;
        try {
            audit = patchService.execute(request);
            for (AuditEntry entry : audit.entries()) out.println(entry.toLine());
            out.println(audit.summaryLine());
        } catch (ShorthandException | UsageException e) {
            error = e.getMessage();
            logger.error("Batch aborted, {} left unchanged: {}", request.document(), e.getMessage());
            out.println("error: " + e.getMessage());
            exitCode = USAGE;
        } catch (IOException | RuntimeException e) {
            error = e.getMessage();
            logger.error("Batch aborted, {} left unchanged", request.document(), e);
            out.println("error: " + e.getMessage());
            exitCode = FAILED;
        }

        if (reportService.isEnabled()) {
            try {
                reportService.writeAll(reportService.build(request, audit, error));
            } catch (RuntimeException e) {
                logger.error("Failed to write patch reports", e);
                if (exitCode == OK) exitCode = FAILED;
            }
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
