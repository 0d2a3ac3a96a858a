package org.metapatch.render;

/**
 * Where a fragment is going: {@code gap} is the line break and indentation in front of it, {@code unit} one
 * nesting level. Form fragments also need the id pools and their owner (the table for a column item, the attribute
 * for an attribute column).
 */
public record RenderContext(String gap, String unit, FormIdPools ids, String ownerName, String ownerDataPath) {

    public static RenderContext of(String gap, String unit) {
        return new RenderContext(gap, unit, null, null, null);
    }

    public RenderContext withOwner(FormIdPools pools, String name, String dataPath) {
        return new RenderContext(gap, unit, pools, name, dataPath);
    }

    FormIdPools requireIds() {
        if (ids == null) throw new IllegalStateException("Form id pools are required to render form items");
        return ids;
    }
}
