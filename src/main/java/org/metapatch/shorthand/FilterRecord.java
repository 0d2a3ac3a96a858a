package org.metapatch.shorthand;

import org.metapatch.dialect.DcsVocabulary.ComparisonType;

import java.util.List;

/**
 * Comparison filter item. {@code values} is empty for unary operators or when no value was given; more than one
 * value, or a list operator, renders a value list. {@code viewMode} is null unless a view mode tag was present.
 */
public record FilterRecord(String field, ComparisonType comparison, List<TypedValue> values, boolean enabled,
                           boolean userSetting, String viewMode, LocalizedText title) implements EntityRecord {

    public FilterRecord {
        values = List.copyOf(values);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.FILTER;
    }

    @Override
    public String displayName() {
        return field;
    }
}
