package org.metapatch.shorthand;

import org.metapatch.dialect.MetadataKinds;
import org.metapatch.dialect.Vocabulary;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps type tokens ({@code decimal(15,2)}, {@code строка(50)}, {@code Справочник.Товары}) to canonical value types.
 * <p>
 * An exact synonym wins; otherwise a unique case-insensitive prefix of at least three characters is accepted.
 * Dotted tokens whose kind is a known reference kind become configuration references, other dotted or
 * namespace-prefixed tokens pass through unchanged.
 */
public final class TypeResolver {

    private static final int MIN_PREFIX = 3;
    private static final int DEFAULT_DIGITS = 10;
    private static final Pattern TOKEN = Pattern.compile("^([^()]+?)\\s*(?:\\((.*)\\))?$");

    private enum Base {
        BOOLEAN, STRING, DECIMAL, DATE, DATE_TIME, TIME, STANDARD_PERIOD, STANDARD_BEGINNING_DATE, UUID, VALUE_TABLE
    }

    private static final Vocabulary<Base> SYNONYMS = new Vocabulary<Base>("type")
            .put(Base.BOOLEAN, "boolean", "bool", "булево")
            .put(Base.STRING, "string", "str", "строка")
            .put(Base.DECIMAL, "decimal", "number", "num", "число")
            .put(Base.DATE, "date", "дата")
            .put(Base.DATE_TIME, "datetime", "датавремя")
            .put(Base.TIME, "time", "время")
            .put(Base.STANDARD_PERIOD, "StandardPeriod", "СтандартныйПериод")
            .put(Base.STANDARD_BEGINNING_DATE, "StandardBeginningDate", "СтандартнаяДатаНачала")
            .put(Base.UUID, "UUID", "УникальныйИдентификатор")
            .put(Base.VALUE_TABLE, "ValueTable", "ТаблицаЗначений");

    public ValueType resolve(String raw) {
        String token = raw == null ? "" : raw.trim();
        if (token.isEmpty()) throw new ShorthandException("Empty type", raw);
        Matcher m = TOKEN.matcher(token);
        if (!m.matches()) throw new ShorthandException("Malformed type", token);
        String head = m.group(1).trim();
        String args = m.group(2);

        if (head.indexOf('.') > 0) {
            if (args != null) throw new ShorthandException("Reference types take no qualifiers", token);
            return dotted(head);
        }
        if (head.indexOf(':') > 0) {
            return ValueType.plain(head);
        }
        Base base = base(head);
        String[] parts = args == null || args.isBlank() ? new String[0] : args.split(",");
        return switch (base) {
            case STRING -> string(parts, token);
            case DECIMAL -> decimal(parts, token);
            default -> {
                if (parts.length > 0) throw new ShorthandException("Type takes no qualifiers", token);
                yield simple(base);
            }
        };
    }

    private static ValueType dotted(String head) {
        int dot = head.indexOf('.');
        String kind = head.substring(0, dot);
        String name = head.substring(dot + 1);
        if (name.isEmpty()) throw new ShorthandException("Reference type without object name", head);
        Optional<MetadataKinds.Kind> ref = MetadataKinds.findReference(kind);
        return ref.map(k -> ValueType.reference(k.referenceType() + "." + name))
                .orElseGet(() -> ValueType.plain(head));
    }

    private static Base base(String head) {
        Optional<Base> exact = SYNONYMS.find(head);
        if (exact.isPresent()) return exact.get();
        String lower = head.toLowerCase(Locale.ROOT);
        if (lower.length() >= MIN_PREFIX) {
            Set<Base> hits = new LinkedHashSet<>();
            Set<String> spelled = new LinkedHashSet<>();
            for (String term : SYNONYMS.terms()) {
                if (term.toLowerCase(Locale.ROOT).startsWith(lower)) {
                    hits.add(SYNONYMS.find(term).orElseThrow());
                    spelled.add(term);
                }
            }
            if (hits.size() == 1) return hits.iterator().next();
            if (hits.size() > 1)
                throw new ShorthandException("Ambiguous type prefix, candidates " + String.join(", ", spelled), head);
        }
        throw new ShorthandException("Unknown type", head, SYNONYMS.suggest(head));
    }

    private static ValueType simple(Base base) {
        return switch (base) {
            case BOOLEAN -> ValueType.plain(ValueType.BOOLEAN);
            case DATE -> ValueType.dateTime("Date");
            case DATE_TIME -> ValueType.dateTime("DateTime");
            case TIME -> ValueType.dateTime("Time");
            case STANDARD_PERIOD -> ValueType.plain(ValueType.STANDARD_PERIOD);
            case STANDARD_BEGINNING_DATE -> ValueType.plain(ValueType.STANDARD_BEGINNING_DATE);
            case UUID -> ValueType.plain(ValueType.UUID);
            case VALUE_TABLE -> ValueType.plain(ValueType.VALUE_TABLE);
            case STRING -> ValueType.string(0, false);
            case DECIMAL -> ValueType.decimal(DEFAULT_DIGITS, 0, false);
        };
    }

    private static ValueType string(String[] parts, String token) {
        if (parts.length > 2) throw new ShorthandException("string takes (length[, fixed])", token);
        int length = parts.length > 0 ? number(parts[0], token) : 0;
        boolean fixed = false;
        if (parts.length == 2) {
            String mode = parts[1].trim().toLowerCase(Locale.ROOT);
            if (mode.equals("fixed") || mode.equals("фиксированная")) fixed = true;
            else if (!mode.equals("variable") && !mode.equals("переменная"))
                throw new ShorthandException("Unknown string length mode", parts[1].trim());
        }
        return ValueType.string(length, fixed);
    }

    private static ValueType decimal(String[] parts, String token) {
        if (parts.length > 3) throw new ShorthandException("decimal takes (digits[, fraction[, +]])", token);
        int digits = parts.length > 0 ? number(parts[0], token) : DEFAULT_DIGITS;
        int fraction = parts.length > 1 ? number(parts[1], token) : 0;
        boolean nonNegative = false;
        if (parts.length == 3) {
            String sign = parts[2].trim().toLowerCase(Locale.ROOT);
            if (sign.equals("+") || sign.equals("nonneg") || sign.equals("nonnegative") || sign.equals("неотрицательное"))
                nonNegative = true;
            else if (!sign.equals("any") && !sign.equals("любой"))
                throw new ShorthandException("Unknown sign constraint", parts[2].trim());
        }
        if (fraction > digits) throw new ShorthandException("Fraction digits exceed total digits", token);
        return ValueType.decimal(digits, fraction, nonNegative);
    }

    private static int number(String part, String token) {
        try {
            int n = Integer.parseInt(part.trim());
            if (n < 0) throw new ShorthandException("Negative qualifier", token);
            return n;
        } catch (NumberFormatException e) {
            throw new ShorthandException("Qualifier is not a number", part.trim());
        }
    }
}
