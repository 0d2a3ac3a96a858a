package org.metapatch.shorthand;

import org.metapatch.dialect.DcsVocabulary.Restriction;

import java.util.Set;

public record CalculatedFieldRecord(String dataPath, String expression, ValueType type, LocalizedText title,
                                    Set<Restriction> restrictions) implements EntityRecord {

    public CalculatedFieldRecord {
        restrictions = Set.copyOf(restrictions);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.CALCULATED_FIELD;
    }

    @Override
    public String displayName() {
        return dataPath;
    }
}
