package org.metapatch.xml;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Which children count as entities of a kind ({@code tag}, any element when null) and which selectors make up
 * their identity. A selector reads the first match unless a reader was registered for it.
 */
public record IdentitySpec(String tag, List<String> paths, Map<String, Function<XmlNode, String>> readers) {

    public IdentitySpec {
        paths = List.copyOf(paths);
        readers = Map.copyOf(readers);
    }

    public static IdentitySpec of(String tag, String... paths) {
        return new IdentitySpec(tag, Arrays.asList(paths), Map.of());
    }

    /** The same spec with {@code path} read by {@code reader}, for parts that need every match or a canonical form. */
    public IdentitySpec withReader(String path, Function<XmlNode, String> reader) {
        if (!paths.contains(path)) throw new IllegalArgumentException("Unknown identity selector " + path);
        Map<String, Function<XmlNode, String>> copy = new HashMap<>(readers);
        copy.put(path, reader);
        return new IdentitySpec(tag, paths, copy);
    }

    public boolean applies(XmlNode node) {
        return tag == null || tag.equals(node.name());
    }

    /** Extracts the key of an existing (or freshly rendered) node; missing selectors read as "". */
    public IdentityKey keyOf(XmlNode node) {
        List<IdentityKey.Component> components = new ArrayList<>(paths.size());
        for (String path : paths) {
            Function<XmlNode, String> reader = readers.get(path);
            components.add(new IdentityKey.Component(path, reader != null ? reader.apply(node) : node.select(path)));
        }
        return new IdentityKey(tag, components);
    }

    /** Builds a key from values given in selector order. */
    public IdentityKey key(String... values) {
        if (values.length != paths.size())
            throw new IllegalArgumentException("Expected " + paths.size() + " identity values for " + this);
        List<IdentityKey.Component> components = new ArrayList<>(paths.size());
        for (int i = 0; i < values.length; i++) {
            components.add(new IdentityKey.Component(paths.get(i), values[i]));
        }
        return new IdentityKey(tag, components);
    }
}
