package org.metapatch.dialect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Case-insensitive synonym table mapping shorthand tokens (English and Russian) to a value.
 */
public final class Vocabulary<V> {

    private final String description;
    private final Map<String, V> bySynonym = new LinkedHashMap<>();
    private final Map<String, String> spelling = new LinkedHashMap<>();

    public Vocabulary(String description) {
        this.description = description;
    }

    public Vocabulary<V> put(V value, String... synonyms) {
        for (String synonym : synonyms) {
            String key = synonym.toLowerCase(Locale.ROOT);
            bySynonym.put(key, value);
            spelling.put(key, synonym);
        }
        return this;
    }

    public Optional<V> find(String token) {
        if (token == null) return Optional.empty();
        return Optional.ofNullable(bySynonym.get(token.trim().toLowerCase(Locale.ROOT)));
    }

    /** Canonical spelling of a known synonym ("сумма" → "Сумма"). */
    public Optional<String> spellingOf(String token) {
        if (token == null) return Optional.empty();
        return Optional.ofNullable(spelling.get(token.trim().toLowerCase(Locale.ROOT)));
    }

    public Set<String> terms() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(spelling.values()));
    }

    public String suggest(String token) {
        return Suggestions.nearest(token, terms());
    }

    public String description() {
        return description;
    }
}
