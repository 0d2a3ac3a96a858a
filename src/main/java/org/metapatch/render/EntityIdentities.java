package org.metapatch.render;

import org.metapatch.dialect.DcsVocabulary;
import org.metapatch.shorthand.AttributeColumnRecord;
import org.metapatch.shorthand.CalculatedFieldRecord;
import org.metapatch.shorthand.ColumnRecord;
import org.metapatch.shorthand.ConditionalAppearanceRecord;
import org.metapatch.shorthand.ConfigurationObjectRecord;
import org.metapatch.shorthand.DataSourceRecord;
import org.metapatch.shorthand.DatasetRecord;
import org.metapatch.shorthand.EntityRecord;
import org.metapatch.shorthand.FieldRecord;
import org.metapatch.shorthand.FilterRecord;
import org.metapatch.shorthand.LinkRecord;
import org.metapatch.shorthand.OrderRecord;
import org.metapatch.shorthand.ParameterRecord;
import org.metapatch.shorthand.RightRecord;
import org.metapatch.shorthand.SelectionRecord;
import org.metapatch.shorthand.TotalRecord;
import org.metapatch.shorthand.VariantRecord;
import org.metapatch.xml.IdentityKey;
import org.metapatch.xml.IdentitySpec;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Identity of each entity kind: which elements count as entities and which of their parts make two of them the
 * same. Keys built from a record equal the keys extracted from the rendered fragment.
 */
public final class EntityIdentities {

    public static final IdentitySpec FIELD = IdentitySpec.of("field", "dataPath");
    public static final IdentitySpec TOTAL = IdentitySpec.of("totalField", "dataPath");
    public static final IdentitySpec CALCULATED_FIELD = IdentitySpec.of("calculatedField", "dataPath");
    public static final IdentitySpec PARAMETER = IdentitySpec.of("parameter", "name");
    public static final IdentitySpec FILTER = IdentitySpec.of("dcsset:item", "dcsset:left");
    public static final IdentitySpec ORDER = IdentitySpec.of("dcsset:item", "@xsi:type", "dcsset:field");
    public static final IdentitySpec SELECTION = IdentitySpec.of("dcsset:item", "@xsi:type", "dcsset:field");
    public static final IdentitySpec LINK = IdentitySpec.of("dataSetLink",
            "sourceDataSet", "destinationDataSet", "sourceExpression", "destinationExpression");
    public static final IdentitySpec DATASET = IdentitySpec.of("dataSet", "name");
    public static final IdentitySpec DATA_SOURCE = IdentitySpec.of("dataSource", "name");
    public static final IdentitySpec VARIANT = IdentitySpec.of("settingsVariant", "dcsset:name");
    private static final String APPEARANCE_PARAMETERS = "dcsset:appearance/dcscor:item/dcscor:parameter";
    private static final String APPEARANCE_CONDITIONS = "dcsset:filter/dcsset:item/dcsset:left";
    private static final String APPEARANCE_FIELDS = "dcsset:selection/dcsset:item/dcsset:field";
    /**
     * Parameters are compared by their canonical id, so Russian and English spellings match. Conditions and fields
     * count as sets.
     */
    public static final IdentitySpec CONDITIONAL_APPEARANCE = IdentitySpec.of("dcsset:item",
                    APPEARANCE_PARAMETERS, APPEARANCE_CONDITIONS, APPEARANCE_FIELDS)
            .withReader(APPEARANCE_PARAMETERS, node -> joinSorted(node.selectAll(APPEARANCE_PARAMETERS).stream()
                    .map(EntityIdentities::parameterId).toList()))
            .withReader(APPEARANCE_CONDITIONS, node -> joinSorted(node.selectAll(APPEARANCE_CONDITIONS)))
            .withReader(APPEARANCE_FIELDS, node -> joinSorted(node.selectAll(APPEARANCE_FIELDS)));
    /** Column items differ in element name (input, check box, label), so any element with a matching path counts. */
    public static final IdentitySpec COLUMN = IdentitySpec.of(null, "DataPath");
    public static final IdentitySpec ATTRIBUTE_COLUMN = IdentitySpec.of("Column", "@name");
    public static final IdentitySpec RIGHT = IdentitySpec.of("object", "name");

    private EntityIdentities() {
    }

    /** Configuration objects are scalar children named after their kind. */
    public static IdentitySpec configurationObject(String metadataKind) {
        return IdentitySpec.of(metadataKind, "");
    }

    public static IdentitySpec specOf(EntityRecord record) {
        return switch (record.kind()) {
            case FIELD -> FIELD;
            case TOTAL -> TOTAL;
            case CALCULATED_FIELD -> CALCULATED_FIELD;
            case PARAMETER -> PARAMETER;
            case FILTER -> FILTER;
            case ORDER -> ORDER;
            case SELECTION -> SELECTION;
            case LINK -> LINK;
            case DATASET -> DATASET;
            case DATA_SOURCE -> DATA_SOURCE;
            case VARIANT -> VARIANT;
            case CONDITIONAL_APPEARANCE -> CONDITIONAL_APPEARANCE;
            case COLUMN -> COLUMN;
            case ATTRIBUTE_COLUMN -> ATTRIBUTE_COLUMN;
            case RIGHT -> RIGHT;
            case CONFIGURATION_OBJECT -> configurationObject(((ConfigurationObjectRecord) record).metadataKind());
        };
    }

    /**
     * Key of the entity a record describes. {@code ownerDataPath} is the data path of the table a column belongs
     * to and is ignored by other kinds.
     */
    public static IdentityKey keyOf(EntityRecord record, String ownerDataPath) {
        IdentitySpec spec = specOf(record);
        return switch (record.kind()) {
            case FIELD -> spec.key(((FieldRecord) record).dataPath());
            case TOTAL -> spec.key(((TotalRecord) record).dataPath());
            case CALCULATED_FIELD -> spec.key(((CalculatedFieldRecord) record).dataPath());
            case PARAMETER -> spec.key(((ParameterRecord) record).name());
            case FILTER -> spec.key(((FilterRecord) record).field());
            case ORDER -> {
                OrderRecord o = (OrderRecord) record;
                yield o.isAuto() ? spec.key("dcsset:OrderItemAuto", "")
                        : spec.key("dcsset:OrderItemField", o.field());
            }
            case SELECTION -> {
                SelectionRecord s = (SelectionRecord) record;
                yield s.isAuto() ? spec.key("dcsset:SelectedItemAuto", "")
                        : spec.key("dcsset:SelectedItemField", s.field());
            }
            case LINK -> {
                LinkRecord l = (LinkRecord) record;
                yield spec.key(l.sourceDataSet(), l.destinationDataSet(), l.sourceExpression(),
                        l.destinationExpression());
            }
            case DATASET -> spec.key(((DatasetRecord) record).name());
            case DATA_SOURCE -> spec.key(((DataSourceRecord) record).name());
            case VARIANT -> spec.key(((VariantRecord) record).name());
            case CONDITIONAL_APPEARANCE -> {
                ConditionalAppearanceRecord a = (ConditionalAppearanceRecord) record;
                yield spec.key(a.parameter().name(),
                        a.condition() == null ? "" : a.condition().field(),
                        joinSorted(a.fields()));
            }
            case COLUMN -> spec.key(columnDataPath(ownerDataPath, ((ColumnRecord) record).name()));
            case ATTRIBUTE_COLUMN -> spec.key(((AttributeColumnRecord) record).name());
            case RIGHT -> spec.key(((RightRecord) record).objectName());
            case CONFIGURATION_OBJECT -> spec.key(((ConfigurationObjectRecord) record).name());
        };
    }

    private static String parameterId(String name) {
        return DcsVocabulary.APPEARANCE.find(name).map(Enum::name).orElse(name);
    }

    private static String joinSorted(List<String> values) {
        return values.stream()
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .sorted()
                .collect(Collectors.joining(","));
    }

    public static String columnDataPath(String ownerDataPath, String column) {
        return ownerDataPath == null || ownerDataPath.isEmpty() ? column : ownerDataPath + "." + column;
    }

    public static String columnElementName(String ownerName, String column) {
        return ownerName == null ? column : ownerName + column;
    }
}
