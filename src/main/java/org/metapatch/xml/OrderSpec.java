package org.metapatch.xml;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Canonical order of child kinds inside one kind of container.
 */
public final class OrderSpec {

    /** Placeholder kind standing for every element name the spec does not list (scalar properties). */
    public static final String OTHER = "*";

    private final String container;
    private final List<String> kinds;
    private final Function<XmlNode, String> displayKey;

    private OrderSpec(String container, List<String> kinds, Function<XmlNode, String> displayKey) {
        this.container = container;
        this.kinds = kinds;
        this.displayKey = displayKey;
    }

    public static OrderSpec of(String container, String... kinds) {
        return new OrderSpec(container, Collections.unmodifiableList(Arrays.asList(kinds)), null);
    }

    /** Same kinds; siblings of one kind are additionally kept sorted by the extracted key. */
    public OrderSpec withDisplayKey(Function<XmlNode, String> extractor) {
        return new OrderSpec(container, kinds, extractor);
    }

    public String container() {
        return container;
    }

    public List<String> kinds() {
        return kinds;
    }

    /**
     * Position of {@code kind}; kinds not listed take the position of the {@value #OTHER} entry when the spec has
     * one, otherwise -1.
     */
    public int indexOf(String kind) {
        int index = kinds.indexOf(kind);
        return index >= 0 ? index : kinds.indexOf(OTHER);
    }

    public boolean contains(String kind) {
        return indexOf(kind) >= 0;
    }

    String displayKeyOf(XmlNode node) {
        return displayKey == null ? null : displayKey.apply(node);
    }

    boolean sortsByDisplayKey() {
        return displayKey != null;
    }

    /**
     * True when no known kind appears after a kind ordered later. Unknown kinds are ignored.
     */
    public boolean isConsistent(List<XmlNode> children) {
        int highest = -1;
        for (XmlNode child : children) {
            int index = indexOf(child.name());
            if (index < 0) continue;
            if (index < highest) return false;
            highest = index;
        }
        return true;
    }

    @Override
    public String toString() {
        return container + kinds;
    }
}
