package org.metapatch.render;

import org.metapatch.dialect.DcsVocabulary;
import org.metapatch.dialect.DcsVocabulary.Restriction;
import org.metapatch.dialect.DcsVocabulary.Role;
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
import org.metapatch.shorthand.LocalizedText;
import org.metapatch.shorthand.OrderRecord;
import org.metapatch.shorthand.ParameterRecord;
import org.metapatch.shorthand.RightRecord;
import org.metapatch.shorthand.SelectionRecord;
import org.metapatch.shorthand.TotalRecord;
import org.metapatch.shorthand.TypedValue;
import org.metapatch.shorthand.ValueType;
import org.metapatch.shorthand.VariantRecord;
import org.metapatch.xml.XmlNode;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Turns entity records into detached fragments laid out for their future position.
 * <p>
 * Element and property order inside each fragment follows what the platform writes, so a patched file diffs against
 * one saved by the designer without reordering noise.
 */
public final class FragmentRenderer {

    static final String CURRENT_CONFIG_NS = "http://v8.1c.ru/8.1/data/enterprise/current-config";
    private static final String EMPTY_DATE = "0001-01-01T00:00:00";

    private final String defaultLanguage;
    private final Supplier<UUID> uuids;

    public FragmentRenderer(String defaultLanguage, Supplier<UUID> uuids) {
        this.defaultLanguage = defaultLanguage;
        this.uuids = uuids;
    }

    public XmlNode render(EntityRecord record, RenderContext ctx) {
        XmlNode node = switch (record.kind()) {
            case FIELD -> field((FieldRecord) record);
            case TOTAL -> total((TotalRecord) record);
            case CALCULATED_FIELD -> calculatedField((CalculatedFieldRecord) record);
            case PARAMETER -> parameter((ParameterRecord) record);
            case FILTER -> comparison((FilterRecord) record);
            case ORDER -> order((OrderRecord) record);
            case SELECTION -> selection((SelectionRecord) record);
            case LINK -> link((LinkRecord) record);
            case DATASET -> dataset((DatasetRecord) record);
            case DATA_SOURCE -> dataSource((DataSourceRecord) record);
            case VARIANT -> variant((VariantRecord) record);
            case CONDITIONAL_APPEARANCE -> appearance((ConditionalAppearanceRecord) record);
            case COLUMN -> column((ColumnRecord) record, ctx);
            case ATTRIBUTE_COLUMN -> attributeColumn((AttributeColumnRecord) record, ctx);
            case RIGHT -> rightsObject((RightRecord) record);
            case CONFIGURATION_OBJECT -> configurationObject((ConfigurationObjectRecord) record);
        };
        return node.layout(ctx.gap(), ctx.unit());
    }

    /** A single {@code <right>} entry, for merging into an existing rights object. */
    public XmlNode rightEntry(String right, boolean value, RenderContext ctx) {
        return right(right, value).layout(ctx.gap(), ctx.unit());
    }

    /* ===================== Data composition schema ===================== */

    private XmlNode field(FieldRecord f) {
        XmlNode node = XmlNode.element("field").attr("xsi:type", "DataSetFieldField")
                .add(XmlNode.leaf("dataPath", f.dataPath()))
                .add(XmlNode.leaf("field", f.dataPath()));
        if (f.title() != null) node.add(localString("title", f.title()));
        if (!f.restrictions().isEmpty()) node.add(useRestriction(f.restrictions()));
        if (!f.roles().isEmpty()) node.add(role(f.roles()));
        if (f.type() != null) node.add(valueType("valueType", f.type(), true));
        return node;
    }

    private XmlNode total(TotalRecord t) {
        return XmlNode.element("totalField")
                .add(XmlNode.leaf("dataPath", t.dataPath()))
                .add(XmlNode.leaf("expression", t.expression()));
    }

    private XmlNode calculatedField(CalculatedFieldRecord c) {
        XmlNode node = XmlNode.element("calculatedField")
                .add(XmlNode.leaf("dataPath", c.dataPath()))
                .add(XmlNode.leaf("expression", c.expression()));
        if (c.title() != null) node.add(localString("title", c.title()));
        if (!c.restrictions().isEmpty()) node.add(useRestriction(c.restrictions()));
        if (c.type() != null) node.add(valueType("valueType", c.type(), true));
        return node;
    }

    private XmlNode parameter(ParameterRecord p) {
        XmlNode node = XmlNode.element("parameter").add(XmlNode.leaf("name", p.name()));
        if (p.title() != null) node.add(localString("title", p.title()));
        if (p.type() != null) node.add(valueType("valueType", p.type(), true));
        node.add(parameterValue(p));
        flag(node, "useRestriction", p.hidden());
        flag(node, "availableAsField", p.availableAsField());
        flag(node, "valueListAllowed", p.valueListAllowed());
        flag(node, "denyIncompleteValues", p.required());
        if (p.alwaysUsed()) node.add(XmlNode.leaf("use", "Always"));
        return node;
    }

    private XmlNode parameterValue(ParameterRecord p) {
        String typeName = p.type() == null ? null : p.type().name();
        TypedValue v = p.defaultValue();
        if (ValueType.STANDARD_PERIOD.equals(typeName)) {
            XmlNode value = XmlNode.element("value").attr("xsi:type", "v8:StandardPeriod")
                    .add(XmlNode.leaf("v8:variant", v == null ? "Custom" : v.text())
                            .attr("xsi:type", "v8:StandardPeriodVariant"));
            if (v == null) {
                value.add(XmlNode.leaf("v8:startDate", EMPTY_DATE)).add(XmlNode.leaf("v8:endDate", EMPTY_DATE));
            }
            return value;
        }
        if (ValueType.STANDARD_BEGINNING_DATE.equals(typeName)) {
            XmlNode value = XmlNode.element("value").attr("xsi:type", "v8:StandardBeginningDate")
                    .add(XmlNode.leaf("v8:variant", v == null ? "Custom" : v.text())
                            .attr("xsi:type", "v8:StandardBeginningDateVariant"));
            if (v == null) value.add(XmlNode.leaf("v8:date", EMPTY_DATE));
            return value;
        }
        if (v == null) return XmlNode.empty("value").attr("xsi:nil", "true");
        return typed("value", v);
    }

    private static void flag(XmlNode node, String name, boolean value) {
        DcsVocabulary.FlagEmission rule = DcsVocabulary.PARAMETER_FLAGS.getOrDefault(name,
                DcsVocabulary.FlagEmission.ONLY_TRUE);
        if (rule.emits(value)) node.add(XmlNode.leaf(name, String.valueOf(value)));
    }

    private XmlNode comparison(FilterRecord f) {
        XmlNode node = XmlNode.element("dcsset:item").attr("xsi:type", "dcsset:FilterItemComparison");
        if (!f.enabled()) node.add(XmlNode.leaf("dcsset:use", "false"));
        node.add(XmlNode.leaf("dcsset:left", f.field()).attr("xsi:type", "dcscor:Field"));
        node.add(XmlNode.leaf("dcsset:comparisonType", f.comparison().xmlName()));
        if (f.comparison().takesList() || f.values().size() > 1) {
            XmlNode list = XmlNode.element("dcsset:right").attr("xsi:type", "v8:ValueListType")
                    .add(XmlNode.empty("v8:valueType"))
                    .add(XmlNode.leaf("v8:lastId", "-1").attr("xsi:type", "xs:decimal"));
            for (TypedValue v : f.values()) {
                list.add(XmlNode.element("v8:item").add(typed("v8:value", v)));
            }
            node.add(list);
        } else if (!f.values().isEmpty()) {
            node.add(typed("dcsset:right", f.values().get(0)));
        }
        if (f.title() != null && !f.userSetting()) node.add(localString("dcsset:presentation", f.title()));
        if (f.viewMode() != null) node.add(XmlNode.leaf("dcsset:viewMode", f.viewMode()));
        if (f.userSetting()) {
            node.add(XmlNode.leaf("dcsset:userSettingID", uuids.get().toString()));
            if (f.title() != null) node.add(localString("dcsset:userSettingPresentation", f.title()));
        }
        return node;
    }

    private static XmlNode order(OrderRecord o) {
        if (o.isAuto()) return XmlNode.empty("dcsset:item").attr("xsi:type", "dcsset:OrderItemAuto");
        return XmlNode.element("dcsset:item").attr("xsi:type", "dcsset:OrderItemField")
                .add(XmlNode.leaf("dcsset:field", o.field()))
                .add(XmlNode.leaf("dcsset:orderType", o.direction()));
    }

    private XmlNode selection(SelectionRecord s) {
        if (s.isAuto()) return XmlNode.empty("dcsset:item").attr("xsi:type", "dcsset:SelectedItemAuto");
        XmlNode node = XmlNode.element("dcsset:item").attr("xsi:type", "dcsset:SelectedItemField")
                .add(XmlNode.leaf("dcsset:field", s.field()));
        if (s.title() != null) node.add(localString("dcsset:lwsTitle", s.title()));
        return node;
    }

    private static XmlNode link(LinkRecord l) {
        XmlNode node = XmlNode.element("dataSetLink")
                .add(XmlNode.leaf("sourceDataSet", l.sourceDataSet()))
                .add(XmlNode.leaf("destinationDataSet", l.destinationDataSet()))
                .add(XmlNode.leaf("sourceExpression", l.sourceExpression()))
                .add(XmlNode.leaf("destinationExpression", l.destinationExpression()));
        if (l.parameter() != null) node.add(XmlNode.leaf("parameter", l.parameter()));
        return node;
    }

    private static XmlNode dataset(DatasetRecord d) {
        XmlNode node = XmlNode.element("dataSet").attr("xsi:type", d.datasetKind().xsiType())
                .add(XmlNode.leaf("name", d.name()));
        switch (d.datasetKind()) {
            case QUERY -> {
                if (d.dataSource() != null) node.add(XmlNode.leaf("dataSource", d.dataSource()));
                node.add(XmlNode.leaf("query", d.body() == null ? "" : d.body()));
            }
            case OBJECT -> {
                if (d.dataSource() != null) node.add(XmlNode.leaf("dataSource", d.dataSource()));
                node.add(XmlNode.leaf("objectName", d.body()));
            }
            case UNION -> {
            }
        }
        return node;
    }

    private static XmlNode dataSource(DataSourceRecord s) {
        return XmlNode.element("dataSource")
                .add(XmlNode.leaf("name", s.name()))
                .add(XmlNode.leaf("dataSourceType", s.type()));
    }

    private XmlNode variant(VariantRecord v) {
        XmlNode group = XmlNode.element("dcsset:item").attr("xsi:type", "dcsset:StructureItemGroup")
                .add(XmlNode.element("dcsset:order").add(order(OrderRecord.auto())))
                .add(XmlNode.element("dcsset:selection").add(selection(SelectionRecord.auto())));
        XmlNode settings = XmlNode.element("dcsset:settings")
                .attr("xmlns:style", "http://v8.1c.ru/8.1/data/ui/style")
                .attr("xmlns:sys", "http://v8.1c.ru/8.1/data/ui/fonts/system")
                .attr("xmlns:web", "http://v8.1c.ru/8.1/data/ui/colors/web")
                .attr("xmlns:win", "http://v8.1c.ru/8.1/data/ui/colors/windows")
                .add(group);
        return XmlNode.element("settingsVariant")
                .add(XmlNode.leaf("dcsset:name", v.name()))
                .add(localString("dcsset:presentation", v.presentation()))
                .add(settings);
    }

    private XmlNode appearance(ConditionalAppearanceRecord a) {
        XmlNode item = XmlNode.element("dcsset:item");
        if (a.fields().isEmpty()) {
            item.add(XmlNode.empty("dcsset:selection"));
        } else {
            XmlNode selection = XmlNode.element("dcsset:selection");
            for (String f : a.fields()) {
                selection.add(XmlNode.element("dcsset:item").add(XmlNode.leaf("dcsset:field", f)));
            }
            item.add(selection);
        }
        if (a.condition() == null) item.add(XmlNode.empty("dcsset:filter"));
        else item.add(XmlNode.element("dcsset:filter").add(comparison(a.condition())));

        XmlNode value = switch (a.parameter().valueKind()) {
            case COLOR -> XmlNode.leaf("dcscor:value", a.value()).attr("xsi:type", "v8ui:Color");
            case BOOLEAN -> XmlNode.leaf("dcscor:value", a.value()).attr("xsi:type", "xs:boolean");
            case HORIZONTAL_ALIGN -> XmlNode.leaf("dcscor:value", a.value()).attr("xsi:type", "v8ui:HorizontalAlign");
            case TEXT -> localString("dcscor:value", LocalizedText.of(defaultLanguage, a.value()));
        };
        item.add(XmlNode.element("dcsset:appearance")
                .add(XmlNode.element("dcscor:item").attr("xsi:type", "dcsset:SettingsParameterValue")
                        .add(XmlNode.leaf("dcscor:parameter", a.parameter().nameFor(defaultLanguage)))
                        .add(value)));
        if (a.title() != null) item.add(localString("dcsset:presentation", a.title()));
        return item;
    }

    private static XmlNode useRestriction(Set<Restriction> restrictions) {
        XmlNode node = XmlNode.element("useRestriction");
        for (Restriction r : Restriction.values()) {
            if (restrictions.contains(r)) node.add(XmlNode.leaf(r.element(), "true"));
        }
        return node;
    }

    private static XmlNode role(Set<Role> roles) {
        XmlNode node = XmlNode.element("role");
        for (Role r : Role.values()) {
            if (!roles.contains(r)) continue;
            if (r == Role.PERIOD) {
                node.add(XmlNode.leaf("dcscom:periodNumber", "1"));
                node.add(XmlNode.leaf("dcscom:periodType", "Main"));
            } else {
                node.add(XmlNode.leaf("dcscom:" + r.element(), "true"));
            }
        }
        return node;
    }

    /* ===================== Managed form ===================== */

    private XmlNode column(ColumnRecord c, RenderContext ctx) {
        IdAllocator items = ctx.requireIds().items();
        String elementName = EntityIdentities.columnElementName(ctx.ownerName(), c.name());
        XmlNode node = XmlNode.element(c.columnKind().element())
                .attr("name", elementName)
                .attr("id", String.valueOf(items.next()));
        node.add(XmlNode.leaf("DataPath", EntityIdentities.columnDataPath(ctx.ownerDataPath(), c.name())));
        if (c.readOnly()) node.add(XmlNode.leaf("ReadOnly", "true"));
        if (c.title() != null) node.add(formTitle(c.title()));
        boolean russian = "ru".equalsIgnoreCase(defaultLanguage);
        node.add(XmlNode.empty("ContextMenu")
                .attr("name", elementName + (russian ? "КонтекстноеМеню" : "ContextMenu"))
                .attr("id", String.valueOf(items.next())));
        node.add(XmlNode.empty("ExtendedTooltip")
                .attr("name", elementName + (russian ? "РасширеннаяПодсказка" : "ExtendedTooltip"))
                .attr("id", String.valueOf(items.next())));
        return node;
    }

    private XmlNode attributeColumn(AttributeColumnRecord c, RenderContext ctx) {
        XmlNode node = XmlNode.element("Column")
                .attr("name", c.name())
                .attr("id", String.valueOf(ctx.requireIds().columns(ctx.ownerName()).next()));
        if (c.title() != null) node.add(formTitle(c.title()));
        if (c.type() != null) node.add(valueType("Type", c.type(), false));
        return node;
    }

    private static XmlNode formTitle(LocalizedText title) {
        XmlNode node = XmlNode.element("Title").attr("formatted", "false");
        title.values().forEach((lang, text) -> node.add(localItem(lang, text)));
        return node;
    }

    /* ===================== Roles and configuration ===================== */

    private static XmlNode rightsObject(RightRecord r) {
        XmlNode node = XmlNode.element("object").add(XmlNode.leaf("name", r.objectName()));
        for (Map.Entry<String, Boolean> e : r.rights().entrySet()) {
            node.add(right(e.getKey(), e.getValue()));
        }
        return node;
    }

    private static XmlNode right(String name, boolean value) {
        return XmlNode.element("right")
                .add(XmlNode.leaf("name", name))
                .add(XmlNode.leaf("value", String.valueOf(value)));
    }

    private static XmlNode configurationObject(ConfigurationObjectRecord o) {
        return XmlNode.leaf(o.metadataKind(), o.name());
    }

    /* ===================== Shared blocks ===================== */

    /** Multi-locale text: a list of locale items even for a single value. */
    private static XmlNode localString(String name, LocalizedText text) {
        XmlNode node = XmlNode.element(name).attr("xsi:type", "v8:LocalStringType");
        text.values().forEach((lang, value) -> node.add(localItem(lang, value)));
        return node;
    }

    private static XmlNode localItem(String lang, String text) {
        return XmlNode.element("v8:item")
                .add(XmlNode.leaf("v8:lang", lang))
                .add(XmlNode.leaf("v8:content", text));
    }

    private static XmlNode typed(String name, TypedValue v) {
        return XmlNode.leaf(name, v.text()).attr("xsi:type", v.type().xsiType());
    }

    /**
     * Type description block. Schema documents declare the configuration namespace on each reference type; form
     * documents use the {@code cfg} prefix declared on the root.
     */
    static XmlNode valueType(String name, ValueType type, boolean schema) {
        XmlNode node = XmlNode.element(name);
        if (type.reference()) {
            XmlNode t = schema
                    ? XmlNode.leaf("v8:Type", "d5p1:" + type.name()).attr("xmlns:d5p1", CURRENT_CONFIG_NS)
                    : XmlNode.leaf("v8:Type", "cfg:" + type.name());
            return node.add(t);
        }
        node.add(XmlNode.leaf("v8:Type", type.name()));
        if (type.string() != null) {
            node.add(XmlNode.element("v8:StringQualifiers")
                    .add(XmlNode.leaf("v8:Length", String.valueOf(type.string().length())))
                    .add(XmlNode.leaf("v8:AllowedLength", type.string().fixed() ? "Fixed" : "Variable")));
        }
        if (type.number() != null) {
            node.add(XmlNode.element("v8:NumberQualifiers")
                    .add(XmlNode.leaf("v8:Digits", String.valueOf(type.number().digits())))
                    .add(XmlNode.leaf("v8:FractionDigits", String.valueOf(type.number().fractionDigits())))
                    .add(XmlNode.leaf("v8:AllowedSign", type.number().nonNegative() ? "Nonnegative" : "Any")));
        }
        if (type.date() != null) {
            node.add(XmlNode.element("v8:DateQualifiers")
                    .add(XmlNode.leaf("v8:DateFractions", type.date().fractions())));
        }
        return node;
    }
}
