package org.metapatch.shorthand;

public record TotalRecord(String dataPath, String expression) implements EntityRecord {

    @Override
    public EntityKind kind() {
        return EntityKind.TOTAL;
    }

    @Override
    public String displayName() {
        return dataPath;
    }
}
