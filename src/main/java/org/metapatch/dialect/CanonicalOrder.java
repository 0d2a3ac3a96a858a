package org.metapatch.dialect;

import org.metapatch.xml.OrderSpec;

/**
 * Order tables for the containers the patcher inserts into.
 */
public final class CanonicalOrder {

    private CanonicalOrder() {
    }

    /* ===================== Data composition schema ===================== */

    public static final OrderSpec DCS_ROOT = OrderSpec.of("DataCompositionSchema",
            "dataSource", "dataSet", "dataSetLink", "calculatedField", "totalField", "parameter",
            "template", "fieldTemplate", "groupTemplate", "groupHeaderTemplate", "totalFieldsTemplate",
            "settingsVariant");

    public static final OrderSpec DCS_DATASET = OrderSpec.of("dataSet",
            "name", "field", "dataSource", "query", "objectName", "item", "autoFillFields");

    public static final OrderSpec DCS_VARIANT = OrderSpec.of("settingsVariant",
            "dcsset:name", "dcsset:presentation", "dcsset:settings");

    public static final OrderSpec DCS_SETTINGS = OrderSpec.of("dcsset:settings",
            "dcsset:selection", "dcsset:filter", "dcsset:order", "dcsset:conditionalAppearance",
            "dcsset:outputParameters", "dcsset:dataParameters", "dcsset:item");

    /** Selection, filter, order and conditional appearance lists: items first, then the list's own settings. */
    public static final OrderSpec DCS_SETTINGS_LIST = OrderSpec.of("settings list",
            "dcsset:item", "dcsset:viewMode", "dcsset:userSettingID", "dcsset:userSettingPresentation");

    public static final OrderSpec DCS_FIELD = OrderSpec.of("field",
            "dataPath", "field", "title", "useRestriction", "attributeUseRestriction", "role", "valueType",
            "appearance", "presentationExpression");

    public static final OrderSpec DCS_CALCULATED_FIELD = OrderSpec.of("calculatedField",
            "dataPath", "expression", "title", "useRestriction", "attributeUseRestriction", "valueType",
            "appearance");

    public static final OrderSpec DCS_TOTAL_FIELD = OrderSpec.of("totalField",
            "dataPath", "expression", "group");

    public static final OrderSpec DCS_PARAMETER = OrderSpec.of("parameter",
            "name", "title", "valueType", "value", "useRestriction", "expression", "availableAsField",
            "valueListAllowed", "availableValue", "denyIncompleteValues", "use");

    /* ===================== Managed form ===================== */

    public static final OrderSpec FORM_ROOT = OrderSpec.of("Form",
            OrderSpec.OTHER, "AutoCommandBar", "Events", "ChildItems", "Attributes", "Commands", "Parameters",
            "CommandSet", "CommandInterface", "BaseForm");

    public static final OrderSpec FORM_TABLE = OrderSpec.of("Table",
            OrderSpec.OTHER, "ContextMenu", "AutoCommandBar", "ExtendedTooltip", "SearchStringAddition",
            "ViewStatusAddition", "SearchControlAddition", "Events", "ChildItems");

    public static final OrderSpec FORM_ATTRIBUTE = OrderSpec.of("Attribute",
            "Title", "Type", OrderSpec.OTHER, "Columns", "Settings");

    /* ===================== Role rights ===================== */

    public static final OrderSpec ROLE_ROOT = OrderSpec.of("Rights",
            "setForNewObjects", "setForAttributesByDefault", "independentRightsOfChildObjects", "object",
            "restrictionTemplate");

    public static final OrderSpec ROLE_OBJECT = OrderSpec.of("object", "name", "right");

    /* ===================== Configuration ===================== */

    public static final OrderSpec CONFIGURATION = OrderSpec.of("Configuration",
            "InternalInfo", "Properties", "ChildObjects");

    public static final OrderSpec CHILD_OBJECTS = OrderSpec.of("ChildObjects",
            MetadataKinds.childObjectOrder().toArray(new String[0]));
}
