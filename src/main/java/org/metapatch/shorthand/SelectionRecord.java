package org.metapatch.shorthand;

/** Selected field; a null field is the automatic selection marker. */
public record SelectionRecord(String field, LocalizedText title) implements EntityRecord {

    public static SelectionRecord auto() {
        return new SelectionRecord(null, null);
    }

    public boolean isAuto() {
        return field == null;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.SELECTION;
    }

    @Override
    public String displayName() {
        return isAuto() ? "Auto" : field;
    }
}
