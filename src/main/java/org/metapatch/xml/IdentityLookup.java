package org.metapatch.xml;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds existing entities in a container by identity key.
 */
public final class IdentityLookup {

    private IdentityLookup() {
    }

    public static boolean exists(XmlNode container, IdentitySpec spec, IdentityKey key) {
        return findFirst(container, spec, key) != null;
    }

    public static XmlNode findFirst(XmlNode container, IdentitySpec spec, IdentityKey key) {
        if (container == null) return null;
        for (XmlNode child : container.children()) {
            if (spec.applies(child) && spec.keyOf(child).equals(key)) return child;
        }
        return null;
    }

    public static List<XmlNode> findAll(XmlNode container, IdentitySpec spec, IdentityKey key) {
        List<XmlNode> out = new ArrayList<>();
        if (container == null) return out;
        for (XmlNode child : container.children()) {
            if (spec.applies(child) && spec.keyOf(child).equals(key)) out.add(child);
        }
        return out;
    }
}
