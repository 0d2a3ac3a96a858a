package org.metapatch.shorthand;

public enum EntityKind {
    FIELD("field"),
    TOTAL("total"),
    CALCULATED_FIELD("calculated field"),
    PARAMETER("parameter"),
    FILTER("filter"),
    ORDER("order"),
    SELECTION("selection"),
    LINK("link"),
    DATASET("dataset"),
    DATA_SOURCE("data source"),
    VARIANT("variant"),
    CONDITIONAL_APPEARANCE("conditional appearance"),
    COLUMN("column"),
    ATTRIBUTE_COLUMN("attribute column"),
    RIGHT("right"),
    CONFIGURATION_OBJECT("object");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    /** Name used in audit lines. */
    public String label() {
        return label;
    }
}
