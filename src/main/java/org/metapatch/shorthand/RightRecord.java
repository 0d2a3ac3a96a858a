package org.metapatch.shorthand;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rights of a role on one object ({@code Catalog.Products}); each right maps to its granted value.
 */
public record RightRecord(String objectName, Map<String, Boolean> rights) implements EntityRecord {

    public RightRecord {
        rights = Collections.unmodifiableMap(new LinkedHashMap<>(rights));
    }

    @Override
    public EntityKind kind() {
        return EntityKind.RIGHT;
    }

    @Override
    public String displayName() {
        if (rights.isEmpty()) return objectName;
        StringBuilder sb = new StringBuilder(objectName).append(':');
        rights.forEach((right, value) -> sb.append(' ').append(value ? "" : "!").append(right));
        return sb.toString();
    }
}
