package org.metapatch.shorthand;

public record VariantRecord(String name, LocalizedText presentation) implements EntityRecord {

    @Override
    public EntityKind kind() {
        return EntityKind.VARIANT;
    }

    @Override
    public String displayName() {
        return name;
    }
}
