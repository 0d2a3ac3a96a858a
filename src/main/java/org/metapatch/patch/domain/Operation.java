package org.metapatch.patch.domain;

import org.metapatch.dialect.Dialect;
import org.metapatch.dialect.Suggestions;

import java.util.ArrayList;
import java.util.List;

/**
 * Operations accepted on the command line, with the dialect each applies to.
 */
public enum Operation {

    ADD_FIELD("add-field", Dialect.DCS, Action.ADD),
    ADD_TOTAL("add-total", Dialect.DCS, Action.ADD),
    ADD_CALCULATED_FIELD("add-calculated-field", Dialect.DCS, Action.ADD),
    ADD_PARAMETER("add-parameter", Dialect.DCS, Action.ADD),
    ADD_FILTER("add-filter", Dialect.DCS, Action.ADD),
    ADD_ORDER("add-order", Dialect.DCS, Action.ADD),
    ADD_SELECTION("add-selection", Dialect.DCS, Action.ADD),
    ADD_LINK("add-link", Dialect.DCS, Action.ADD),
    ADD_DATASET("add-dataset", Dialect.DCS, Action.ADD),
    ADD_VARIANT("add-variant", Dialect.DCS, Action.ADD),
    ADD_CONDITIONAL_APPEARANCE("add-conditional-appearance", Dialect.DCS, Action.ADD),
    REMOVE_FIELD("remove-field", Dialect.DCS, Action.REMOVE),
    REMOVE_TOTAL("remove-total", Dialect.DCS, Action.REMOVE),
    REMOVE_CALCULATED_FIELD("remove-calculated-field", Dialect.DCS, Action.REMOVE),
    REMOVE_PARAMETER("remove-parameter", Dialect.DCS, Action.REMOVE),
    REMOVE_FILTER("remove-filter", Dialect.DCS, Action.REMOVE),
    REMOVE_ORDER("remove-order", Dialect.DCS, Action.REMOVE),
    REMOVE_SELECTION("remove-selection", Dialect.DCS, Action.REMOVE),
    REMOVE_DATASET("remove-dataset", Dialect.DCS, Action.REMOVE),
    REMOVE_VARIANT("remove-variant", Dialect.DCS, Action.REMOVE),
    SET_QUERY("set-query", Dialect.DCS, Action.SET),
    SET_EXPRESSION("set-expression", Dialect.DCS, Action.SET),
    CLEAR_SELECTION("clear-selection", Dialect.DCS, Action.CLEAR),
    CLEAR_FILTER("clear-filter", Dialect.DCS, Action.CLEAR),
    CLEAR_ORDER("clear-order", Dialect.DCS, Action.CLEAR),

    ADD_COLUMN("add-column", Dialect.FORM, Action.ADD),
    REMOVE_COLUMN("remove-column", Dialect.FORM, Action.REMOVE),

    ADD_RIGHT("add-right", Dialect.ROLE, Action.ADD),
    REMOVE_RIGHT("remove-right", Dialect.ROLE, Action.REMOVE),

    ADD_OBJECT("add-object", Dialect.CONFIGURATION, Action.ADD),
    REMOVE_OBJECT("remove-object", Dialect.CONFIGURATION, Action.REMOVE);

    public enum Action {
        ADD,
        REMOVE,
        SET,
        CLEAR
    }

    private final String cliName;
    private final Dialect dialect;
    private final Action action;

    Operation(String cliName, Dialect dialect, Action action) {
        this.cliName = cliName;
        this.dialect = dialect;
        this.action = action;
    }

    public String cliName() {
        return cliName;
    }

    public Dialect dialect() {
        return dialect;
    }

    public Action action() {
        return action;
    }

    /** Clear operations address a whole list and take no values. */
    public boolean takesValues() {
        return action != Action.CLEAR;
    }

    public static Operation fromName(String name) {
        for (Operation op : values()) {
            if (op.cliName.equalsIgnoreCase(name)) return op;
        }
        List<String> names = new ArrayList<>();
        for (Operation op : values()) names.add(op.cliName);
        String suggestion = Suggestions.nearest(name, names);
        throw new UsageException("Unknown operation '" + name + "'"
                + (suggestion == null ? "" : " (did you mean '" + suggestion + "'?)"));
    }
}
