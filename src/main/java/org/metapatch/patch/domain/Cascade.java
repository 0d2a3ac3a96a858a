package org.metapatch.patch.domain;

import org.metapatch.shorthand.EntityRecord;

/**
 * Secondary edit requested by a primary one; executed by the service unless cascades are switched off.
 * {@code target} names the container the same way {@code --target} does, null meaning the default one.
 */
public record Cascade(Operation.Action action, EntityRecord record, String target) {

    public static Cascade add(EntityRecord record, String target) {
        return new Cascade(Operation.Action.ADD, record, target);
    }

    public static Cascade remove(EntityRecord record, String target) {
        return new Cascade(Operation.Action.REMOVE, record, target);
    }
}
