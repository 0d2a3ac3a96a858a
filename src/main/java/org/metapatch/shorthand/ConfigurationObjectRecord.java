package org.metapatch.shorthand;

/** Top-level metadata object listed under {@code ChildObjects}; {@code metadataKind} is the canonical kind name. */
public record ConfigurationObjectRecord(String metadataKind, String name) implements EntityRecord {

    @Override
    public EntityKind kind() {
        return EntityKind.CONFIGURATION_OBJECT;
    }

    @Override
    public String displayName() {
        return metadataKind + "." + name;
    }
}
