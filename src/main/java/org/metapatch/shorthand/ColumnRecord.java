package org.metapatch.shorthand;

/** Form table column. */
public record ColumnRecord(String name, ValueType type, LocalizedText title, ColumnKind columnKind,
                           boolean readOnly) implements EntityRecord {

    public enum ColumnKind {
        INPUT("InputField"),
        CHECK("CheckBoxField"),
        LABEL("LabelField");

        private final String element;

        ColumnKind(String element) {
            this.element = element;
        }

        public String element() {
            return element;
        }
    }

    @Override
    public EntityKind kind() {
        return EntityKind.COLUMN;
    }

    @Override
    public String displayName() {
        return name;
    }
}
