package org.metapatch.patch.reporting;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.File;

public class JsonPatchReportWriter {
    private final ObjectMapper mapper;

    public JsonPatchReportWriter() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public File write(File outputDir, PatchReportModels.PatchReport report, String fileName) {
        try {
            if (!outputDir.exists()) outputDir.mkdirs();
            File out = new File(outputDir, fileName);
            mapper.writeValue(out, report);
            return out;
        } catch (Exception e) {
            throw new RuntimeException("Failed to write JSON patch report", e);
        }
    }
}
