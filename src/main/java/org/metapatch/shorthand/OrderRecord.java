package org.metapatch.shorthand;

/** Order item; a null field is the automatic order marker. */
public record OrderRecord(String field, String direction) implements EntityRecord {

    public static OrderRecord auto() {
        return new OrderRecord(null, null);
    }

    public boolean isAuto() {
        return field == null;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.ORDER;
    }

    @Override
    public String displayName() {
        return isAuto() ? "Auto" : field + " " + direction;
    }
}
