package org.metapatch.shorthand;

/**
 * Intermediate form of one shorthand entry, consumed by the fragment renderer and discarded.
 */
public sealed interface EntityRecord permits FieldRecord, TotalRecord, CalculatedFieldRecord, ParameterRecord,
        FilterRecord, OrderRecord, SelectionRecord, LinkRecord, DatasetRecord, DataSourceRecord, VariantRecord,
        ConditionalAppearanceRecord, ColumnRecord, AttributeColumnRecord, RightRecord, ConfigurationObjectRecord {

    EntityKind kind();

    /** Short name shown in audit lines. */
    String displayName();
}
