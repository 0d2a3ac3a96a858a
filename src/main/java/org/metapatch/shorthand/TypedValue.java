package org.metapatch.shorthand;

/**
 * A literal from the right-hand side of a filter, condition or default value, with the type inferred from its
 * spelling.
 */
public record TypedValue(Type type, String text) {

    public enum Type {
        STRING("xs:string"),
        NUMBER("xs:decimal"),
        BOOLEAN("xs:boolean"),
        DATE("xs:dateTime"),
        DESIGN_TIME("dcscor:DesignTimeValue");

        private final String xsiType;

        Type(String xsiType) {
            this.xsiType = xsiType;
        }

        public String xsiType() {
            return xsiType;
        }
    }
}
