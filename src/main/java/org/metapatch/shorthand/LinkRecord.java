package org.metapatch.shorthand;

public record LinkRecord(String sourceDataSet, String destinationDataSet, String sourceExpression,
                         String destinationExpression, String parameter) implements EntityRecord {

    @Override
    public EntityKind kind() {
        return EntityKind.LINK;
    }

    @Override
    public String displayName() {
        return sourceDataSet + " > " + destinationDataSet + " on " + sourceExpression + " = " + destinationExpression;
    }
}
