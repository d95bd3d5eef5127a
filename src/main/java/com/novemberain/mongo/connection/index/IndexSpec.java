package com.novemberain.mongo.connection.index;

import com.mongodb.client.model.IndexOptions;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.concurrent.TimeUnit;

/**
 * One secondary index: key definition plus creation options.
 */
public final class IndexSpec {

    static final String INDEX = "index";
    static final String OPTIONS = "options";

    private final Bson keys;
    private final IndexOptions options;

    private IndexSpec(Bson keys, IndexOptions options) {
        if (keys == null) {
            throw new IllegalArgumentException("Index keys are required.");
        }
        this.keys = keys;
        this.options = options == null ? new IndexOptions() : options;
    }

    public static IndexSpec of(Bson keys) {
        return new IndexSpec(keys, null);
    }

    public static IndexSpec of(Bson keys, IndexOptions options) {
        return new IndexSpec(keys, options);
    }

    /**
     * Reads a declaration of the form {@code {index: {sku: 1}, options: {unique: true}}}.
     * Unknown option names are ignored.
     */
    public static IndexSpec fromDocument(Document declaration) {
        final Document keys = declaration.get(INDEX, Document.class);
        if (keys == null) {
            throw new IllegalArgumentException("Index declaration has no '" + INDEX + "' document: " + declaration.toJson());
        }
        return new IndexSpec(keys, toIndexOptions(declaration.get(OPTIONS, Document.class)));
    }

    static IndexOptions toIndexOptions(Document doc) {
        final IndexOptions options = new IndexOptions();
        if (doc == null) {
            return options;
        }
        if (doc.containsKey("name")) {
            options.name(doc.getString("name"));
        }
        if (doc.containsKey("unique")) {
            options.unique(doc.getBoolean("unique"));
        }
        if (doc.containsKey("sparse")) {
            options.sparse(doc.getBoolean("sparse"));
        }
        if (doc.containsKey("background")) {
            options.background(doc.getBoolean("background"));
        }
        if (doc.containsKey("expireAfterSeconds")) {
            options.expireAfter(doc.get("expireAfterSeconds", Number.class).longValue(), TimeUnit.SECONDS);
        }
        if (doc.containsKey("partialFilterExpression")) {
            options.partialFilterExpression(doc.get("partialFilterExpression", Document.class));
        }
        if (doc.containsKey("weights")) {
            options.weights(doc.get("weights", Document.class));
        }
        if (doc.containsKey("default_language")) {
            options.defaultLanguage(doc.getString("default_language"));
        }
        return options;
    }

    public Bson getKeys() {
        return keys;
    }

    public IndexOptions getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return "IndexSpec{keys=" + keys + ", options=" + options + '}';
    }
}
