package org.metapatch.shorthand;

import org.metapatch.dialect.DcsVocabulary;
import org.metapatch.dialect.DcsVocabulary.AppearanceParameter;
import org.metapatch.dialect.DcsVocabulary.ComparisonType;
import org.metapatch.dialect.DcsVocabulary.DatasetKind;
import org.metapatch.dialect.DcsVocabulary.Restriction;
import org.metapatch.dialect.DcsVocabulary.Role;
import org.metapatch.dialect.MetadataKinds;
import org.metapatch.dialect.RightsVocabulary;
import org.metapatch.dialect.Suggestions;
import org.metapatch.dialect.Vocabulary;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles one-line shorthand entries into entity records.
 * <p>
 * Common syntax: {@code [Title]} anywhere in the entry (a title of the form {@code [ru:Текст|en:Text]} supplies
 * several locales), {@code @tag} and {@code #restriction} tokens in any order, {@code : type} after the name.
 * Every error names the offending literal; unknown vocabulary terms come with the nearest known one.
 */
public final class ShorthandParser {

    private static final Pattern NAME = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*(\\.[\\p{L}\\p{N}_]+)*");
    private static final Pattern LOCALE_ITEM = Pattern.compile("^([a-z]{2})\\s*:\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern SYMBOLIC_OPERATOR =
            Pattern.compile("^(\\S+?)\\s*(<>|!=|>=|<=|=|>|<)\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern WORD_OPERATOR = Pattern.compile("^(\\S+)\\s+(\\S+)(?:\\s+(.*))?$", Pattern.DOTALL);
    private static final Pattern LINK_PARAMETER =
            Pattern.compile("\\[(?:param|параметр)\\s+([^\\]]+)\\]", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern LINK = Pattern.compile("^(\\S+)\\s*>\\s*(\\S+)\\s+(?:on|по)\\s+(.+?)\\s*=\\s*(.+)$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    private static final Pattern APPEARANCE = Pattern.compile(
            "^(.+?)\\s*=\\s*(.+?)(?:\\s+(?:when|когда)\\s+(.+?))?(?:\\s+(?:for|для)\\s+(.+))?$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}(T\\d{2}:\\d{2}:\\d{2})?");
    private static final Pattern DOTTED = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*(\\.[\\p{L}\\p{N}_]+)+");

    private static final List<String> PARAMETER_TAGS = List.of("hidden", "nofield", "list", "required", "always");
    private static final List<String> FILTER_TAGS = List.of("user", "off", "quick", "normal", "inaccessible");
    private static final List<String> COLUMN_TAGS = List.of("readonly", "check", "label");

    private final String defaultLanguage;
    private final TypeResolver types;

    public ShorthandParser(String defaultLanguage) {
        this(defaultLanguage, new TypeResolver());
    }

    public ShorthandParser(String defaultLanguage, TypeResolver types) {
        this.defaultLanguage = defaultLanguage;
        this.types = types;
    }

    public String defaultLanguage() {
        return defaultLanguage;
    }

    /** Splits a batch argument into trimmed, non-empty entries. */
    public static List<String> splitBatch(String raw, String separator) {
        List<String> out = new ArrayList<>();
        if (raw == null) return out;
        for (String part : raw.split(Pattern.quote(separator))) {
            if (!part.isBlank()) out.add(part.trim());
        }
        return out;
    }

    /* ===================== Schema entities ===================== */

    /** {@code Path[: type] [Title] @role... #restriction...} */
    public FieldRecord parseField(String entry) {
        Parts parts = split(entry);
        NameAndType nt = nameAndType(parts.body, entry);
        Set<Role> roles = EnumSet.noneOf(Role.class);
        for (String tag : parts.roles) roles.add(lookup(DcsVocabulary.ROLES, tag, "@"));
        return new FieldRecord(nt.name, nt.type, parts.title, roles, restrictions(parts));
    }

    /** {@code Path: Function} or {@code Path = expression} */
    public TotalRecord parseTotal(String entry) {
        Parts parts = split(entry);
        noTags(parts);
        int eq = parts.body.indexOf('=');
        if (eq >= 0) {
            String path = requireName(parts.body.substring(0, eq).trim(), entry);
            return new TotalRecord(path, requireText(parts.body.substring(eq + 1), "expression", entry));
        }
        int colon = parts.body.indexOf(':');
        if (colon < 0) throw new ShorthandException("Expected 'Path: Function' or 'Path = expression'", entry);
        String path = requireName(parts.body.substring(0, colon).trim(), entry);
        String function = lookup(DcsVocabulary.TOTAL_FUNCTIONS, parts.body.substring(colon + 1).trim(), "");
        return new TotalRecord(path, function + "(" + path + ")");
    }

    /** {@code Path[: type] = expression [Title] #restriction...} */
    public CalculatedFieldRecord parseCalculatedField(String entry) {
        Parts parts = split(entry);
        if (!parts.roles.isEmpty()) throw unknownTag("@" + parts.roles.get(0), List.of());
        int eq = parts.body.indexOf('=');
        if (eq < 0) throw new ShorthandException("Missing '= expression'", entry);
        NameAndType nt = nameAndType(parts.body.substring(0, eq), entry);
        String expression = requireText(parts.body.substring(eq + 1), "expression", entry);
        return new CalculatedFieldRecord(nt.name, expression, nt.type, parts.title, restrictions(parts));
    }

    /** {@code Name[: type] [= default] [Title] @hidden @nofield @list @required @always} */
    public ParameterRecord parseParameter(String entry) {
        Parts parts = split(entry);
        if (!parts.restrictions.isEmpty()) throw unknownTag("#" + parts.restrictions.get(0), List.of());
        Set<String> tags = tags(parts.roles, PARAMETER_TAGS);
        int eq = parts.body.indexOf('=');
        NameAndType nt = nameAndType(eq < 0 ? parts.body : parts.body.substring(0, eq), entry);
        TypedValue value = eq < 0 ? null : value(parts.body.substring(eq + 1));
        if (value != null && nt.type != null && ValueType.STRING.equals(nt.type.name())) {
            value = new TypedValue(TypedValue.Type.STRING, value.text());
        }
        return new ParameterRecord(nt.name, nt.type, value, parts.title,
                tags.contains("hidden"), !tags.contains("nofield"), tags.contains("list"),
                tags.contains("required"), tags.contains("always"));
    }

    /** {@code Field op [value] [Title] @user @off @quick @normal @inaccessible} */
    public FilterRecord parseFilter(String entry) {
        Parts parts = split(entry);
        if (!parts.restrictions.isEmpty()) throw unknownTag("#" + parts.restrictions.get(0), List.of());
        Set<String> tags = tags(parts.roles, FILTER_TAGS);
        String viewMode = null;
        for (String mode : List.of("quick", "normal", "inaccessible")) {
            if (tags.contains(mode)) {
                if (viewMode != null) throw new ShorthandException("Conflicting view modes", entry);
                viewMode = DcsVocabulary.VIEW_MODES.find(mode).orElseThrow();
            }
        }
        FilterRecord condition = condition(parts.body, entry);
        return new FilterRecord(condition.field(), condition.comparison(), condition.values(), !tags.contains("off"),
                tags.contains("user"), viewMode, parts.title);
    }

    /** {@code Field [asc|desc]} or {@code Auto} */
    public OrderRecord parseOrder(String entry) {
        Parts parts = split(entry);
        noTags(parts);
        String[] tokens = parts.body.trim().split("\\s+");
        if (tokens.length == 1 && DcsVocabulary.isAuto(tokens[0])) return OrderRecord.auto();
        if (tokens.length > 2) throw new ShorthandException("Expected 'Field [asc|desc]'", entry);
        String field = requireName(tokens[0], entry);
        String direction = tokens.length == 2 ? lookup(DcsVocabulary.ORDER_DIRECTIONS, tokens[1], "") : "Asc";
        return new OrderRecord(field, direction);
    }

    /** {@code Field [Title]} or {@code Auto} */
    public SelectionRecord parseSelection(String entry) {
        Parts parts = split(entry);
        noTags(parts);
        String body = parts.body.trim();
        if (DcsVocabulary.isAuto(body)) return SelectionRecord.auto();
        return new SelectionRecord(requireName(body, entry), parts.title);
    }

    /** {@code Source > Destination on SourceExpr = DestExpr [param P]} */
    public LinkRecord parseLink(String entry) {
        String text = requireEntry(entry);
        String parameter = null;
        Matcher pm = LINK_PARAMETER.matcher(text);
        if (pm.find()) {
            parameter = requireName(pm.group(1).trim(), entry);
            text = (text.substring(0, pm.start()) + text.substring(pm.end())).trim();
        }
        Matcher m = LINK.matcher(text);
        if (!m.matches())
            throw new ShorthandException("Expected 'Source > Destination on SourceExpr = DestExpr'", entry);
        return new LinkRecord(requireName(m.group(1), entry), requireName(m.group(2), entry),
                m.group(3).trim(), m.group(4).trim(), parameter);
    }

    /** {@code Name[: query|object|union] [= query text or object name]} */
    public DatasetRecord parseDataset(String entry) {
        String text = requireEntry(entry);
        int eq = text.indexOf('=');
        String head = eq < 0 ? text : text.substring(0, eq);
        String body = eq < 0 ? null : text.substring(eq + 1).trim();
        int colon = head.indexOf(':');
        String name = requireName((colon < 0 ? head : head.substring(0, colon)).trim(), entry);
        DatasetKind kind = colon < 0 ? DatasetKind.QUERY
                : lookup(DcsVocabulary.DATASET_KINDS, head.substring(colon + 1).trim(), "");
        if (kind == DatasetKind.UNION && body != null && !body.isEmpty())
            throw new ShorthandException("A union dataset takes no body", entry);
        if (kind == DatasetKind.OBJECT && (body == null || body.isEmpty())) body = name;
        return new DatasetRecord(name, kind, body, null);
    }

    /** {@code Name [Presentation]}; the presentation defaults to the name. */
    public VariantRecord parseVariant(String entry) {
        Parts parts = split(entry);
        noTags(parts);
        String name = requireName(parts.body.trim(), entry);
        LocalizedText presentation = parts.title != null ? parts.title : LocalizedText.of(defaultLanguage, name);
        return new VariantRecord(name, presentation);
    }

    /** {@code Parameter = value [when Field op value] [for Field, Field...] [Title]} */
    public ConditionalAppearanceRecord parseConditionalAppearance(String entry) {
        Parts parts = split(entry);
        noTags(parts);
        Matcher m = APPEARANCE.matcher(parts.body.trim());
        if (!m.matches()) throw new ShorthandException("Expected 'Parameter = value [when ...] [for ...]'", entry);
        AppearanceParameter parameter = lookup(DcsVocabulary.APPEARANCE, m.group(1).trim(), "");
        String value = appearanceValue(parameter, m.group(2).trim());
        FilterRecord condition = m.group(3) == null ? null : condition(m.group(3), entry);
        List<String> fields = new ArrayList<>();
        if (m.group(4) != null) {
            for (String f : m.group(4).split(",")) {
                if (!f.isBlank()) fields.add(requireName(f.trim(), entry));
            }
        }
        return new ConditionalAppearanceRecord(parameter, value, condition, fields, parts.title);
    }

    /* ===================== Form, role and configuration entities ===================== */

    /** {@code Name[: type] [Title] @readonly @check @label} */
    public ColumnRecord parseColumn(String entry) {
        Parts parts = split(entry);
        if (!parts.restrictions.isEmpty()) throw unknownTag("#" + parts.restrictions.get(0), List.of());
        Set<String> tags = tags(parts.roles, COLUMN_TAGS);
        if (tags.contains("check") && tags.contains("label"))
            throw new ShorthandException("A column is either @check or @label", entry);
        NameAndType nt = nameAndType(parts.body, entry);
        ColumnRecord.ColumnKind kind = tags.contains("check") ? ColumnRecord.ColumnKind.CHECK
                : tags.contains("label") ? ColumnRecord.ColumnKind.LABEL : ColumnRecord.ColumnKind.INPUT;
        return new ColumnRecord(nt.name, nt.type, parts.title, kind, tags.contains("readonly"));
    }

    /**
     * {@code Kind.Name: Right Right !Right}; a leading '!' denies the right. With {@code requireRights} false the
     * rights list may be omitted (the whole object is addressed).
     */
    public RightRecord parseRight(String entry, boolean requireRights) {
        String text = requireEntry(entry);
        int colon = text.indexOf(':');
        String object = (colon < 0 ? text : text.substring(0, colon)).trim();
        String kind = objectKind(object, entry, true);
        String objectName = kind + object.substring(object.indexOf('.'));
        Map<String, Boolean> rights = new LinkedHashMap<>();
        if (colon >= 0) {
            for (String token : text.substring(colon + 1).trim().split("[\\s,]+")) {
                if (token.isEmpty()) continue;
                boolean granted = !token.startsWith("!");
                String literal = granted ? token : token.substring(1);
                String right = RightsVocabulary.find(kind, literal).orElseThrow(() -> new ShorthandException(
                        "Unknown right for " + kind, literal, RightsVocabulary.suggest(kind, literal)));
                rights.put(right, granted);
            }
        }
        if (requireRights && rights.isEmpty()) throw new ShorthandException("No rights given", entry);
        return new RightRecord(objectName, rights);
    }

    /** {@code Kind.Name} */
    public ConfigurationObjectRecord parseConfigurationObject(String entry) {
        String object = requireEntry(entry);
        String kind = objectKind(object, entry, false);
        return new ConfigurationObjectRecord(kind, requireName(object.substring(object.indexOf('.') + 1), entry));
    }

    /**
     * Identity part of an entry for removals and modifications: the name before any type, expression, title or
     * tag ({@code "Total: decimal [T] @measure"} gives {@code Total}).
     */
    public String parseName(String entry) {
        Parts parts = split(entry);
        String body = parts.body;
        int cut = body.length();
        for (char c : new char[]{':', '='}) {
            int i = body.indexOf(c);
            if (i >= 0) cut = Math.min(cut, i);
        }
        String head = body.substring(0, cut).trim();
        String first = head.isEmpty() ? head : head.split("\\s+")[0];
        return requireName(first, entry);
    }

    /* ===================== Pieces ===================== */

    /** Parses {@code Field op [value]} into a comparison with default flags. */
    FilterRecord condition(String text, String entry) {
        String body = text.trim();
        String field;
        String operator;
        String rest;
        Matcher symbolic = SYMBOLIC_OPERATOR.matcher(body);
        Matcher words = WORD_OPERATOR.matcher(body);
        if (symbolic.matches()) {
            field = symbolic.group(1);
            operator = symbolic.group(2);
            rest = symbolic.group(3);
        } else if (words.matches()) {
            field = words.group(1);
            operator = words.group(2);
            rest = words.group(3);
        } else {
            throw new ShorthandException("Expected 'Field operator [value]'", entry);
        }
        requireName(field, entry);
        ComparisonType comparison = lookup(DcsVocabulary.OPERATORS, operator, "");
        rest = rest == null ? "" : rest.trim();
        List<TypedValue> values = new ArrayList<>();
        if (comparison.isUnary()) {
            if (!rest.isEmpty()) throw new ShorthandException(comparison.xmlName() + " takes no value", rest);
        } else if (comparison.takesList()) {
            String list = rest.startsWith("(") && rest.endsWith(")") ? rest.substring(1, rest.length() - 1) : rest;
            for (String item : splitList(list)) {
                TypedValue v = value(item);
                if (v != null) values.add(v);
            }
        } else {
            TypedValue v = value(rest);
            if (v != null) values.add(v);
        }
        return new FilterRecord(field, comparison, values, true, false, null, null);
    }

    /** Infers the type of a literal; "" and "_" mean no value. */
    TypedValue value(String raw) {
        String text = raw == null ? "" : raw.trim();
        if (text.isEmpty() || text.equals("_")) return null;
        if (text.length() >= 2 && (text.startsWith("\"") && text.endsWith("\"")
                || text.startsWith("'") && text.endsWith("'"))) {
            return new TypedValue(TypedValue.Type.STRING, text.substring(1, text.length() - 1));
        }
        if (NUMBER.matcher(text).matches()) return new TypedValue(TypedValue.Type.NUMBER, text);
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.equals("true") || lower.equals("истина")) return new TypedValue(TypedValue.Type.BOOLEAN, "true");
        if (lower.equals("false") || lower.equals("ложь")) return new TypedValue(TypedValue.Type.BOOLEAN, "false");
        if (DATE.matcher(text).matches()) {
            return new TypedValue(TypedValue.Type.DATE, text.length() == 10 ? text + "T00:00:00" : text);
        }
        if (DOTTED.matcher(text).matches()) return new TypedValue(TypedValue.Type.DESIGN_TIME, text);
        return new TypedValue(TypedValue.Type.STRING, text);
    }

    private String appearanceValue(AppearanceParameter parameter, String raw) {
        String text = raw;
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            text = text.substring(1, text.length() - 1);
        }
        return switch (parameter.valueKind()) {
            case BOOLEAN -> {
                TypedValue v = value(text);
                if (v == null || v.type() != TypedValue.Type.BOOLEAN)
                    throw new ShorthandException("Expected true or false", raw);
                yield v.text();
            }
            case HORIZONTAL_ALIGN -> lookup(DcsVocabulary.HORIZONTAL_ALIGNS, text, "");
            case COLOR, TEXT -> text;
        };
    }

    private static List<String> splitList(String list) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < list.length(); i++) {
            char c = list.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                current.append(c);
            } else if (c == '"' || c == '\'') {
                quote = c;
                current.append(c);
            } else if (c == ',') {
                out.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        out.add(current.toString());
        return out;
    }

    private String objectKind(String object, String entry, boolean allowConfiguration) {
        int dot = object.indexOf('.');
        if (dot <= 0 || dot == object.length() - 1) throw new ShorthandException("Expected 'Kind.Name'", entry);
        String kindToken = object.substring(0, dot);
        requireName(object.substring(dot + 1), entry);
        if (allowConfiguration && (kindToken.equalsIgnoreCase("Configuration")
                || kindToken.equalsIgnoreCase("Конфигурация"))) {
            return "Configuration";
        }
        return MetadataKinds.find(kindToken).map(MetadataKinds.Kind::name)
                .orElseThrow(() -> new ShorthandException("Unknown metadata kind", kindToken,
                        MetadataKinds.suggest(kindToken)));
    }

    private Set<Restriction> restrictions(Parts parts) {
        Set<Restriction> out = EnumSet.noneOf(Restriction.class);
        for (String tag : parts.restrictions) out.add(lookup(DcsVocabulary.RESTRICTIONS, tag, "#"));
        return out;
    }

    private static Set<String> tags(List<String> found, List<String> allowed) {
        Set<String> out = new LinkedHashSet<>();
        for (String tag : found) {
            String lower = tag.toLowerCase(Locale.ROOT);
            if (!allowed.contains(lower)) throw unknownTag("@" + tag, allowed);
            out.add(lower);
        }
        return out;
    }

    private static void noTags(Parts parts) {
        if (!parts.roles.isEmpty()) throw unknownTag("@" + parts.roles.get(0), List.of());
        if (!parts.restrictions.isEmpty()) throw unknownTag("#" + parts.restrictions.get(0), List.of());
    }

    private static ShorthandException unknownTag(String tag, List<String> allowed) {
        String suggestion = Suggestions.nearest(tag.substring(1), allowed);
        return new ShorthandException("Unknown tag", tag, suggestion == null ? null : tag.charAt(0) + suggestion);
    }

    private static <V> V lookup(Vocabulary<V> vocabulary, String token, String prefix) {
        Optional<V> found = vocabulary.find(token);
        if (found.isPresent()) return found.get();
        String suggestion = vocabulary.suggest(token);
        throw new ShorthandException("Unknown " + vocabulary.description(), prefix + token,
                suggestion == null ? null : prefix + suggestion);
    }

    private NameAndType nameAndType(String body, String entry) {
        int colon = body.indexOf(':');
        String name = requireName((colon < 0 ? body : body.substring(0, colon)).trim(), entry);
        ValueType type = colon < 0 ? null : types.resolve(body.substring(colon + 1));
        return new NameAndType(name, type);
    }

    private static String requireName(String name, String entry) {
        if (name == null || name.isEmpty()) throw new ShorthandException("Missing name", entry);
        if (!NAME.matcher(name).matches()) throw new ShorthandException("Invalid name", name);
        return name;
    }

    private static String requireText(String text, String what, String entry) {
        String t = text == null ? "" : text.trim();
        if (t.isEmpty()) throw new ShorthandException("Missing " + what, entry);
        return t;
    }

    private static String requireEntry(String entry) {
        if (entry == null || entry.isBlank()) throw new ShorthandException("Empty entry", entry);
        return entry.trim();
    }

    /**
     * Title and tags pulled out of an entry; {@code body} is what remains. Double-quoted text is copied as is, tags
     * are only recognized outside quotes and brackets, and only a bracketed block with nothing but tags after it is
     * taken as the title.
     */
    private Parts split(String entry) {
        String text = requireEntry(entry);
        List<String> roles = new ArrayList<>();
        List<String> restrictions = new ArrayList<>();
        StringBuilder body = new StringBuilder();
        int bracketStart = -1;
        int bracketEnd = -1;
        boolean quoted = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && c == '[') {
                int close = closingBracket(text, i);
                if (close > 0) {
                    bracketStart = body.length();
                    body.append(text, i, close + 1);
                    bracketEnd = body.length();
                    i = close + 1;
                    continue;
                }
            } else if (!quoted && (c == '@' || c == '#') && (i == 0 || Character.isWhitespace(text.charAt(i - 1)))) {
                int end = tagEnd(text, i + 1);
                if (end > i + 1) {
                    (c == '@' ? roles : restrictions).add(text.substring(i + 1, end));
                    i = end;
                    continue;
                }
            }
            body.append(c);
            i++;
        }
        LocalizedText title = null;
        if (bracketStart >= 0 && body.substring(bracketEnd).isBlank()) {
            title = title(body.substring(bracketStart + 1, bracketEnd - 1), entry);
            body.setLength(bracketStart);
        }
        String rest = body.toString().trim();
        if (rest.isEmpty()) throw new ShorthandException("Missing name", entry);
        return new Parts(rest, title, roles, restrictions);
    }

    /** Index of the {@code ]} closing the bracket at {@code open}, skipping quoted text, or -1. */
    private static int closingBracket(String text, int open) {
        boolean quoted = false;
        for (int i = open + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') quoted = !quoted;
            else if (!quoted && c == ']') return i;
        }
        return -1;
    }

    /** End of a tag name starting at {@code from}; {@code from} itself when the text there is not a tag. */
    private static int tagEnd(String text, int from) {
        int end = from;
        while (end < text.length() && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_')) end++;
        return end == text.length() || Character.isWhitespace(text.charAt(end)) ? end : from;
    }

    private LocalizedText title(String raw, String entry) {
        String text = raw.trim();
        if (text.isEmpty()) throw new ShorthandException("Empty title", entry);
        String[] segments = text.split("\\|");
        Map<String, String> values = new LinkedHashMap<>();
        for (String segment : segments) {
            Matcher m = LOCALE_ITEM.matcher(segment.trim());
            if (!m.matches()) {
                if (segments.length > 1) throw new ShorthandException("Expected 'lang:text' in title", segment);
                return LocalizedText.of(defaultLanguage, text);
            }
            values.put(m.group(1), m.group(2).trim());
        }
        return new LocalizedText(values);
    }

    private record Parts(String body, LocalizedText title, List<String> roles, List<String> restrictions) {
    }

    private record NameAndType(String name, ValueType type) {
    }
}
