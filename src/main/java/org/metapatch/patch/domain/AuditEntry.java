package org.metapatch.patch.domain;

/**
 * One line of the audit log. {@code kind} and {@code name} are null for warnings not tied to an entity.
 */
public record AuditEntry(Outcome outcome, String kind, String name, String message) {

    public String toLine() {
        StringBuilder sb = new StringBuilder("[").append(outcome).append(']');
        if (kind != null) sb.append(' ').append(kind);
        if (name != null) sb.append(' ').append(name);
        if (message != null) sb.append(kind == null && name == null ? " " : ": ").append(message);
        return sb.toString();
    }
}
