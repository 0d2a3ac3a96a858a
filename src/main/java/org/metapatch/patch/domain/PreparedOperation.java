package org.metapatch.patch.domain;

import org.metapatch.shorthand.EntityRecord;

/**
 * One batch entry compiled before any edit: the parsed record for adds and record based removals, otherwise the
 * addressed {@code name} and, for modifications, the new {@code text}.
 */
public record PreparedOperation(Operation operation, String entry, EntityRecord record, String name, String text) {

    public static PreparedOperation ofRecord(Operation operation, String entry, EntityRecord record) {
        return new PreparedOperation(operation, entry, record, record.displayName(), null);
    }

    public static PreparedOperation ofName(Operation operation, String entry, String name) {
        return new PreparedOperation(operation, entry, null, name, null);
    }

    public static PreparedOperation ofText(Operation operation, String entry, String name, String text) {
        return new PreparedOperation(operation, entry, null, name, text);
    }
}
