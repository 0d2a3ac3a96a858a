package org.metapatch.shorthand;

/** Typed column of a form attribute (value table or tabular section). */
public record AttributeColumnRecord(String name, ValueType type, LocalizedText title) implements EntityRecord {

    @Override
    public EntityKind kind() {
        return EntityKind.ATTRIBUTE_COLUMN;
    }

    @Override
    public String displayName() {
        return name;
    }
}
