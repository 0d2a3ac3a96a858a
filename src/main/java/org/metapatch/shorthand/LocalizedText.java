package org.metapatch.shorthand;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Text in one or more locales; a plain title is stored under the default language.
 */
public record LocalizedText(Map<String, String> values) {

    public LocalizedText {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static LocalizedText of(String language, String text) {
        return new LocalizedText(Map.of(language, text));
    }

    /** Text for {@code language}, else the first one supplied. */
    public String text(String language) {
        String v = values.get(language);
        return v != null ? v : values.values().iterator().next();
    }
}
