package com.novemberain.mongo.connection.index;

import org.bson.Document;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Indexes declared for a collection.
 */
public final class CollectionSpec {

    static final String INDEXES = "indexes";

    private static final CollectionSpec EMPTY = new CollectionSpec(Collections.<IndexSpec>emptyList());

    private final List<IndexSpec> indexes;

    private CollectionSpec(List<IndexSpec> indexes) {
        this.indexes = Collections.unmodifiableList(new ArrayList<>(indexes));
    }

    public static CollectionSpec empty() {
        return EMPTY;
    }

    public static CollectionSpec of(IndexSpec... indexes) {
        return new CollectionSpec(Arrays.asList(indexes));
    }

    public static CollectionSpec of(List<IndexSpec> indexes) {
        return indexes == null ? EMPTY : new CollectionSpec(indexes);
    }

    /**
     * Reads {@code {indexes: [{index: {...}, options: {...}}, ...]}}. A missing
     * {@code indexes} list means no indexes.
     */
    public static CollectionSpec fromDocument(Document definition) {
        if (definition == null) {
            return EMPTY;
        }
        final List<Document> declarations = definition.getList(INDEXES, Document.class);
        if (declarations == null) {
            return EMPTY;
        }
        final List<IndexSpec> indexes = new ArrayList<>(declarations.size());
        for (Document declaration : declarations) {
            indexes.add(IndexSpec.fromDocument(declaration));
        }
        return new CollectionSpec(indexes);
    }

    public List<IndexSpec> getIndexes() {
        return indexes;
    }
}
