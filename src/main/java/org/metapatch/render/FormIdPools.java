package org.metapatch.render;

import org.metapatch.xml.XmlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Id pools of one managed form: form items (including their context menus and tooltips), attributes, commands,
 * and the columns of each attribute. Forms that extend a base form take new ids from the reserved range.
 */
public final class FormIdPools {

    private static final Logger logger = LoggerFactory.getLogger(FormIdPools.class);

    public static final String ITEMS = "items";
    public static final String ATTRIBUTES = "attributes";
    public static final String COMMANDS = "commands";
    private static final String COLUMNS = "columns:";

    private final Map<String, IdAllocator> pools = new HashMap<>();
    private final int first;

    private FormIdPools(int first) {
        this.first = first;
    }

    /**
     * Seeds the pools from the {@code id} attributes found in {@code form}. {@code extensionBase} is the first id
     * of the range used when the form has a {@code BaseForm}.
     */
    public static FormIdPools scan(XmlNode form, int extensionBase) {
        boolean extension = form.child("BaseForm") != null;
        FormIdPools ids = new FormIdPools(extension ? extensionBase : 1);
        ids.collect(form);
        if (logger.isDebugEnabled()) {
            logger.debug("Form id pools{}: {}", extension ? " (extension)" : "", ids.pools.values());
        }
        return ids;
    }

    private void collect(XmlNode node) {
        String id = node.attribute("id");
        if (id != null) {
            try {
                pool(poolOf(node)).reserve(Integer.parseInt(id.trim()));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring non-numeric id '{}' at {}", id, node.path());
            }
        }
        for (XmlNode child : node.children()) collect(child);
    }

    private static String poolOf(XmlNode node) {
        XmlNode parent = node.parent();
        String parentName = parent == null ? "" : parent.name();
        if (node.name().equals("Attribute") && parentName.equals("Attributes")) return ATTRIBUTES;
        if (node.name().equals("Command") && parentName.equals("Commands")) return COMMANDS;
        if (node.name().equals("Column") && parentName.equals("Columns") && parent.parent() != null
                && parent.parent().name().equals("Attribute")) {
            return COLUMNS + parent.parent().attribute("name");
        }
        return ITEMS;
    }

    public IdAllocator pool(String name) {
        return pools.computeIfAbsent(name, n -> new IdAllocator(n, first));
    }

    public IdAllocator items() {
        return pool(ITEMS);
    }

    public IdAllocator attributes() {
        return pool(ATTRIBUTES);
    }

    public IdAllocator commands() {
        return pool(COMMANDS);
    }

    public IdAllocator columns(String attribute) {
        return pool(COLUMNS + attribute);
    }
}
