package org.metapatch.shorthand;

import org.metapatch.dialect.DcsVocabulary.Restriction;
import org.metapatch.dialect.DcsVocabulary.Role;

import java.util.Set;

/** Dataset field; {@code type} and {@code title} are null when omitted. */
public record FieldRecord(String dataPath, ValueType type, LocalizedText title, Set<Role> roles,
                          Set<Restriction> restrictions) implements EntityRecord {

    public FieldRecord {
        roles = Set.copyOf(roles);
        restrictions = Set.copyOf(restrictions);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.FIELD;
    }

    @Override
    public String displayName() {
        return dataPath;
    }
}
