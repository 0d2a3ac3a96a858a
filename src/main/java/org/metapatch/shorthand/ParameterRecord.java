package org.metapatch.shorthand;

/**
 * Schema parameter. {@code defaultValue} is null when no default was given; flags carry the platform defaults
 * unless a tag changed them.
 */
public record ParameterRecord(String name, ValueType type, TypedValue defaultValue, LocalizedText title,
                              boolean hidden, boolean availableAsField, boolean valueListAllowed,
                              boolean required, boolean alwaysUsed) implements EntityRecord {

    @Override
    public EntityKind kind() {
        return EntityKind.PARAMETER;
    }

    @Override
    public String displayName() {
        return name;
    }
}
