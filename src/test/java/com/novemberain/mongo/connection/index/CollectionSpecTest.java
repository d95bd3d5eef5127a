package com.novemberain.mongo.connection.index;

import com.mongodb.client.model.IndexOptions;
import org.bson.Document;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class CollectionSpecTest {

    @Test
    public void shouldReadIndexDeclarations() {
        CollectionSpec spec = CollectionSpec.fromDocument(Document.parse("{indexes: ["
                + "{index: {sku: 1}, options: {unique: true, name: 'sku_unique'}},"
                + "{index: {createdAt: 1}, options: {expireAfterSeconds: 3600, background: true}},"
                + "{index: {email: 1}, options: {sparse: true, partialFilterExpression: {active: true}}},"
                + "{index: {status: 1}}"
                + "]}"));

        List<IndexSpec> indexes = spec.getIndexes();
        assertEquals(4, indexes.size());

        assertEquals(new Document("sku", 1), indexes.get(0).getKeys());
        assertTrue(indexes.get(0).getOptions().isUnique());
        assertEquals("sku_unique", indexes.get(0).getOptions().getName());

        IndexOptions ttl = indexes.get(1).getOptions();
        assertEquals(Long.valueOf(3600), ttl.getExpireAfter(TimeUnit.SECONDS));
        assertTrue(ttl.isBackground());

        IndexOptions partial = indexes.get(2).getOptions();
        assertTrue(partial.isSparse());
        assertEquals(new Document("active", true), partial.getPartialFilterExpression());

        assertFalse(indexes.get(3).getOptions().isUnique());
    }

    @Test
    public void shouldTreatMissingIndexesAsNone() {
        assertTrue(CollectionSpec.fromDocument(new Document()).getIndexes().isEmpty());
        assertTrue(CollectionSpec.fromDocument(null).getIndexes().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldRejectDeclarationWithoutKeys() {
        CollectionSpec.fromDocument(Document.parse("{indexes: [{options: {unique: true}}]}"));
    }

    @Test
    public void shouldKeepDuplicates() {
        IndexSpec sku = IndexSpec.of(new Document("sku", 1));

        assertEquals(2, CollectionSpec.of(sku, sku).getIndexes().size());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void shouldExposeReadOnlyIndexes() {
        CollectionSpec.of(IndexSpec.of(new Document("sku", 1))).getIndexes().clear();
    }
}
