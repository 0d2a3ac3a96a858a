package org.metapatch.patch.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcomes of one invocation, in the order they happened.
 */
public class AuditLog {

    private final List<AuditEntry> entries = new ArrayList<>();

    public void record(Outcome outcome, String kind, String name, String message) {
        entries.add(new AuditEntry(outcome, kind, name, message));
    }

    public void added(String kind, String name) {
        record(Outcome.ADDED, kind, name, null);
    }

    public void removed(String kind, String name) {
        record(Outcome.REMOVED, kind, name, null);
    }

    public void modified(String kind, String name, String message) {
        record(Outcome.MODIFIED, kind, name, message);
    }

    public void skipped(String kind, String name, String message) {
        record(Outcome.SKIPPED, kind, name, message);
    }

    public void warn(String message) {
        record(Outcome.WARN, null, null, message);
    }

    public void warn(String kind, String name, String message) {
        record(Outcome.WARN, kind, name, message);
    }

    public List<AuditEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public int count(Outcome outcome) {
        int n = 0;
        for (AuditEntry e : entries) {
            if (e.outcome() == outcome) n++;
        }
        return n;
    }

    public boolean hasChanges() {
        return count(Outcome.ADDED) + count(Outcome.REMOVED) + count(Outcome.MODIFIED) > 0;
    }

    public String summaryLine() {
        return String.format("Summary: added=%d, removed=%d, modified=%d, skipped=%d, warnings=%d",
                count(Outcome.ADDED), count(Outcome.REMOVED), count(Outcome.MODIFIED),
                count(Outcome.SKIPPED), count(Outcome.WARN));
    }
}
