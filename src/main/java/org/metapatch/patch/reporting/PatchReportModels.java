package org.metapatch.patch.reporting;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class PatchReportModels {

    public static class EntryRow {
        public String outcome; // ADDED | REMOVED | MODIFIED | SKIPPED | WARN
        public String kind;
        public String name;
        public String message;
    }

    public static class Summary {
        public int added;
        public int removed;
        public int modified;
        public int skipped;
        public int warnings;
    }

    public static class PatchReport {
        public String title;
        public LocalDateTime generatedAt;
        public String document;
        public String operation;
        public String dialect;
        public boolean written;
        public String error; // set when the batch was aborted
        public Summary summary;
        public List<EntryRow> entries;

        public boolean isPassing() {
            return error == null && (summary == null || summary.warnings == 0);
        }
    }
}
