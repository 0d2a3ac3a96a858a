package org.metapatch.shorthand;

/**
 * Canonical value type with its optional qualifiers. Reference types carry the configuration type name
 * ({@code CatalogRef.Products}); the renderer chooses the namespace prefix per dialect.
 */
public record ValueType(String name, boolean reference, StringQualifiers string, NumberQualifiers number,
                        DateQualifiers date) {

    public static final String BOOLEAN = "xs:boolean";
    public static final String STRING = "xs:string";
    public static final String DECIMAL = "xs:decimal";
    public static final String DATE_TIME = "xs:dateTime";
    public static final String STANDARD_PERIOD = "v8:StandardPeriod";
    public static final String STANDARD_BEGINNING_DATE = "v8:StandardBeginningDate";
    public static final String UUID = "v8:UUID";
    public static final String VALUE_TABLE = "v8:ValueTable";

    public record StringQualifiers(int length, boolean fixed) {
    }

    public record NumberQualifiers(int digits, int fractionDigits, boolean nonNegative) {
    }

    /** {@code fractions} is one of Date, Time, DateTime. */
    public record DateQualifiers(String fractions) {
    }

    public static ValueType plain(String name) {
        return new ValueType(name, false, null, null, null);
    }

    public static ValueType string(int length, boolean fixed) {
        return new ValueType(STRING, false, new StringQualifiers(length, fixed), null, null);
    }

    public static ValueType decimal(int digits, int fractionDigits, boolean nonNegative) {
        return new ValueType(DECIMAL, false, null, new NumberQualifiers(digits, fractionDigits, nonNegative), null);
    }

    public static ValueType dateTime(String fractions) {
        return new ValueType(DATE_TIME, false, null, null, new DateQualifiers(fractions));
    }

    public static ValueType reference(String typeName) {
        return new ValueType(typeName, true, null, null, null);
    }

    public boolean isBoolean() {
        return BOOLEAN.equals(name);
    }
}
