package org.metapatch.dialect;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Enumerated values of the data composition schema: field roles, use restrictions, comparison operators, total
 * functions, appearance parameters and the flags whose emission rules differ per element.
 */
public final class DcsVocabulary {

    private DcsVocabulary() {
    }

    /** Field roles; rendered under {@code <role>} as {@code dcscom:} elements. */
    public enum Role {
        PERIOD("periodNumber"),
        DIMENSION("dimension"),
        ACCOUNT("account"),
        BALANCE("balance"),
        IGNORE_NULL_VALUES("ignoreNullValues"),
        REQUIRED("required"),
        MEASURE("measure");

        private final String element;

        Role(String element) {
            this.element = element;
        }

        public String element() {
            return element;
        }
    }

    /** Use restrictions; each renders as {@code <element>true</element>} under {@code <useRestriction>}. */
    public enum Restriction {
        NO_FIELD("field"),
        NO_FILTER("condition"),
        NO_GROUP("group"),
        NO_ORDER("order");

        private final String element;

        Restriction(String element) {
            this.element = element;
        }

        public String element() {
            return element;
        }
    }

    public enum ComparisonType {
        EQUAL("Equal"),
        NOT_EQUAL("NotEqual"),
        GREATER("Greater"),
        GREATER_OR_EQUAL("GreaterOrEqual"),
        LESS("Less"),
        LESS_OR_EQUAL("LessOrEqual"),
        IN_LIST("InList"),
        NOT_IN_LIST("NotInList"),
        IN_HIERARCHY("InHierarchy"),
        IN_LIST_BY_HIERARCHY("InListByHierarchy"),
        CONTAINS("Contains"),
        NOT_CONTAINS("NotContains"),
        LIKE("Like"),
        NOT_LIKE("NotLike"),
        BEGINS_WITH("BeginsWith"),
        NOT_BEGINS_WITH("NotBeginsWith"),
        FILLED("Filled"),
        NOT_FILLED("NotFilled");

        private final String xmlName;

        ComparisonType(String xmlName) {
            this.xmlName = xmlName;
        }

        public String xmlName() {
            return xmlName;
        }

        /** Operators that take no right-hand value. */
        public boolean isUnary() {
            return this == FILLED || this == NOT_FILLED;
        }

        /** Operators whose right-hand value is a value list. */
        public boolean takesList() {
            return this == IN_LIST || this == NOT_IN_LIST || this == IN_LIST_BY_HIERARCHY;
        }
    }

    public enum DatasetKind {
        QUERY("DataSetQuery"),
        OBJECT("DataSetObject"),
        UNION("DataSetUnion");

        private final String xsiType;

        DatasetKind(String xsiType) {
            this.xsiType = xsiType;
        }

        public String xsiType() {
            return xsiType;
        }
    }

    /** How the value of an appearance parameter is typed. */
    public enum AppearanceValueKind {
        COLOR, BOOLEAN, TEXT, HORIZONTAL_ALIGN
    }

    public enum AppearanceParameter {
        TEXT_COLOR("ЦветТекста", "TextColor", AppearanceValueKind.COLOR),
        BACK_COLOR("ЦветФона", "BackColor", AppearanceValueKind.COLOR),
        BORDER_COLOR("ЦветГраницы", "BorderColor", AppearanceValueKind.COLOR),
        VISIBLE("Видимость", "Visible", AppearanceValueKind.BOOLEAN),
        ENABLED("Доступность", "Enabled", AppearanceValueKind.BOOLEAN),
        READ_ONLY("ТолькоПросмотр", "ReadOnly", AppearanceValueKind.BOOLEAN),
        MARK_INCOMPLETE("ОтметкаНезаполненного", "MarkIncomplete", AppearanceValueKind.BOOLEAN),
        TEXT("Текст", "Text", AppearanceValueKind.TEXT),
        FORMAT("Формат", "Format", AppearanceValueKind.TEXT),
        HORIZONTAL_ALIGN("ГоризонтальноеПоложение", "HorizontalAlign", AppearanceValueKind.HORIZONTAL_ALIGN);

        private final String russianName;
        private final String englishName;
        private final AppearanceValueKind valueKind;

        AppearanceParameter(String russianName, String englishName, AppearanceValueKind valueKind) {
            this.russianName = russianName;
            this.englishName = englishName;
            this.valueKind = valueKind;
        }

        public String nameFor(String language) {
            return "ru".equalsIgnoreCase(language) ? russianName : englishName;
        }

        public AppearanceValueKind valueKind() {
            return valueKind;
        }
    }

    /** When a boolean flag is written out. */
    public enum FlagEmission {
        /** Written with its value, true or false. */
        ALWAYS,
        /** Written only when true. */
        ONLY_TRUE,
        /** Written only when false; true is the platform default. */
        ONLY_FALSE;

        public boolean emits(boolean value) {
            return switch (this) {
                case ALWAYS -> true;
                case ONLY_TRUE -> value;
                case ONLY_FALSE -> !value;
            };
        }
    }

    /** Emission rules for the boolean children of {@code <parameter>}. */
    public static final Map<String, FlagEmission> PARAMETER_FLAGS = Map.of(
            "useRestriction", FlagEmission.ALWAYS,
            "availableAsField", FlagEmission.ONLY_FALSE,
            "valueListAllowed", FlagEmission.ONLY_TRUE,
            "denyIncompleteValues", FlagEmission.ONLY_TRUE);

    public static final Vocabulary<Role> ROLES = new Vocabulary<Role>("field role")
            .put(Role.DIMENSION, "dimension", "измерение")
            .put(Role.ACCOUNT, "account", "счет")
            .put(Role.BALANCE, "balance", "остаток")
            .put(Role.PERIOD, "period", "период")
            .put(Role.REQUIRED, "required", "обязательное")
            .put(Role.IGNORE_NULL_VALUES, "ignoreNullValues", "игнорироватьЗначенияNull")
            .put(Role.MEASURE, "measure", "ресурс");

    public static final Vocabulary<Restriction> RESTRICTIONS = new Vocabulary<Restriction>("use restriction")
            .put(Restriction.NO_FIELD, "noField", "безПоля")
            .put(Restriction.NO_FILTER, "noFilter", "безОтбора")
            .put(Restriction.NO_GROUP, "noGroup", "безГруппировки")
            .put(Restriction.NO_ORDER, "noOrder", "безПорядка");

    public static final Vocabulary<ComparisonType> OPERATORS = new Vocabulary<ComparisonType>("comparison operator")
            .put(ComparisonType.EQUAL, "=", "eq", "равно")
            .put(ComparisonType.NOT_EQUAL, "<>", "!=", "ne", "неравно")
            .put(ComparisonType.GREATER, ">", "gt", "больше")
            .put(ComparisonType.GREATER_OR_EQUAL, ">=", "ge", "большеилиравно")
            .put(ComparisonType.LESS, "<", "lt", "меньше")
            .put(ComparisonType.LESS_OR_EQUAL, "<=", "le", "меньшеилиравно")
            .put(ComparisonType.IN_LIST, "in", "inlist", "в", "всписке")
            .put(ComparisonType.NOT_IN_LIST, "notin", "notinlist", "невсписке")
            .put(ComparisonType.IN_HIERARCHY, "inhierarchy", "виерархии")
            .put(ComparisonType.IN_LIST_BY_HIERARCHY, "inlistbyhierarchy", "вспискепоиерархии")
            .put(ComparisonType.CONTAINS, "contains", "содержит")
            .put(ComparisonType.NOT_CONTAINS, "notcontains", "несодержит")
            .put(ComparisonType.LIKE, "like", "подобно")
            .put(ComparisonType.NOT_LIKE, "notlike", "неподобно")
            .put(ComparisonType.BEGINS_WITH, "beginswith", "начинаетсяс")
            .put(ComparisonType.NOT_BEGINS_WITH, "notbeginswith", "неначинаетсяс")
            .put(ComparisonType.FILLED, "filled", "заполнено")
            .put(ComparisonType.NOT_FILLED, "notfilled", "незаполнено");

    /** Total functions; the value is the spelling used in the generated expression. */
    public static final Vocabulary<String> TOTAL_FUNCTIONS = new Vocabulary<String>("total function")
            .put("Sum", "Sum").put("Сумма", "Сумма")
            .put("Count", "Count").put("Количество", "Количество")
            .put("Max", "Max").put("Максимум", "Максимум")
            .put("Min", "Min").put("Минимум", "Минимум")
            .put("Avg", "Avg").put("Среднее", "Среднее");

    public static final Vocabulary<String> ORDER_DIRECTIONS = new Vocabulary<String>("order direction")
            .put("Asc", "asc", "возр")
            .put("Desc", "desc", "убыв");

    public static final Vocabulary<DatasetKind> DATASET_KINDS = new Vocabulary<DatasetKind>("dataset kind")
            .put(DatasetKind.QUERY, "query", "запрос")
            .put(DatasetKind.OBJECT, "object", "объект")
            .put(DatasetKind.UNION, "union", "объединение");

    public static final Vocabulary<String> VIEW_MODES = new Vocabulary<String>("view mode")
            .put("QuickAccess", "quick", "быстрый")
            .put("Normal", "normal", "обычный")
            .put("Inaccessible", "inaccessible", "недоступный");

    public static final Vocabulary<AppearanceParameter> APPEARANCE = new Vocabulary<>("appearance parameter");

    public static final Vocabulary<String> HORIZONTAL_ALIGNS = new Vocabulary<String>("horizontal alignment")
            .put("Left", "left", "лево")
            .put("Center", "center", "центр")
            .put("Right", "right", "право")
            .put("Auto", "auto", "авто");

    /** Sentinel for the automatic order/selection item. */
    public static final List<String> AUTO = List.of("auto", "авто");

    static {
        for (AppearanceParameter p : AppearanceParameter.values()) {
            APPEARANCE.put(p, p.russianName, p.englishName);
        }
    }

    public static boolean isAuto(String token) {
        return token != null && AUTO.contains(token.trim().toLowerCase(Locale.ROOT));
    }
}
