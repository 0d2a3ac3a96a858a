package org.metapatch.shorthand;

import org.metapatch.dialect.DcsVocabulary.AppearanceParameter;

import java.util.List;

/**
 * Conditional appearance item: one appearance parameter value, applied to {@code fields} (all fields when empty)
 * where {@code condition} holds (always when null).
 */
public record ConditionalAppearanceRecord(AppearanceParameter parameter, String value, FilterRecord condition,
                                          List<String> fields, LocalizedText title) implements EntityRecord {

    public ConditionalAppearanceRecord {
        fields = List.copyOf(fields);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.CONDITIONAL_APPEARANCE;
    }

    @Override
    public String displayName() {
        String label = parameter.nameFor("en") + " = " + value;
        return condition == null ? label : label + " when " + condition.field();
    }
}
