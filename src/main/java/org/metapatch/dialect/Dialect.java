package org.metapatch.dialect;

import org.metapatch.xml.XmlNode;

import java.util.Arrays;
import java.util.Optional;

/**
 * Document dialects, told apart by the root element.
 */
public enum Dialect {

    DCS("DataCompositionSchema", "data composition schema"),
    FORM("Form", "managed form"),
    ROLE("Rights", "role rights"),
    CONFIGURATION("MetaDataObject", "configuration");

    private final String rootName;
    private final String description;

    Dialect(String rootName, String description) {
        this.rootName = rootName;
        this.description = description;
    }

    public String rootName() {
        return rootName;
    }

    public String description() {
        return description;
    }

    public static Optional<Dialect> detect(XmlNode root) {
        return Arrays.stream(values()).filter(d -> d.rootName.equals(root.localName())).findFirst();
    }
}
