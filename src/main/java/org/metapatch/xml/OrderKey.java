package org.metapatch.xml;

/**
 * Position of a fragment among its future siblings: the kind (element name) orders first, the optional display key
 * orders entries of the same kind.
 */
public record OrderKey(String kind, String displayKey) {

    public static OrderKey of(String kind) {
        return new OrderKey(kind, null);
    }

    public static OrderKey of(String kind, String displayKey) {
        return new OrderKey(kind, displayKey);
    }
}
