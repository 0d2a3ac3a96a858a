package org.metapatch.xml;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Fields that decide whether two entities are the same. Texts are trimmed and compared case-insensitively, the way
 * the platform treats metadata names.
 */
public record IdentityKey(String tag, List<Component> components) {

    public IdentityKey {
        components = List.copyOf(components);
    }

    /** One (selector, text) pair; the selector is relative to the entity element. */
    public record Component(String path, String text) {
        public Component {
            text = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        }
    }

    @Override
    public String toString() {
        return components.stream()
                .map(c -> (c.path().isEmpty() ? "" : c.path() + "=") + c.text())
                .collect(Collectors.joining(", ", (tag == null ? "*" : tag) + "{", "}"));
    }
}
