package org.metapatch.shorthand;

import org.metapatch.dialect.DcsVocabulary.DatasetKind;

/**
 * Dataset; {@code body} is the query text of a query dataset or the object name of an object dataset.
 * {@code dataSource} is filled in from the schema before rendering.
 */
public record DatasetRecord(String name, DatasetKind datasetKind, String body, String dataSource)
        implements EntityRecord {

    public DatasetRecord withDataSource(String source) {
        return new DatasetRecord(name, datasetKind, body, source);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.DATASET;
    }

    @Override
    public String displayName() {
        return name;
    }
}
