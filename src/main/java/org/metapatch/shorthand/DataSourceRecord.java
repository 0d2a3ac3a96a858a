package org.metapatch.shorthand;

public record DataSourceRecord(String name, String type) implements EntityRecord {

    @Override
    public EntityKind kind() {
        return EntityKind.DATA_SOURCE;
    }

    @Override
    public String displayName() {
        return name;
    }
}
