package com.novemberain.mongo.connection;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.novemberain.mongo.connection.index.CollectionSpec;
import com.novemberain.mongo.connection.index.IndexProvisioner;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * An open connection to one MongoDB database. Owns the lifecycle of its {@link MongoClient}.
 *
 * <p>Obtained from {@link com.novemberain.mongo.connection.db.ConnectionBuilder}; the
 * handles never change after construction, so one instance can be shared by all callers.</p>
 */
public class MongoConnection implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(MongoConnection.class);

    private final MongoClient mongoClient;
    private final MongoDatabase database;
    private final IndexProvisioner indexProvisioner;
    private final Executor executor;

    /**
     * @param mongoClient      connected client, closed by {@link #close()}.
     * @param database         database all collection operations are issued against.
     * @param indexProvisioner provisions indexes of created collections.
     * @param executor         runs the driver calls.
     */
    public MongoConnection(final MongoClient mongoClient, final MongoDatabase database,
                           final IndexProvisioner indexProvisioner, final Executor executor) {
        this.mongoClient = mongoClient;
        this.database = database;
        this.indexProvisioner = indexProvisioner;
        this.executor = executor;
    }

    /**
     * Creates a collection, then ensures its declared indexes.
     *
     * <p>If an index cannot be created the future fails with that error and the
     * collection stays in place with whatever indexes did get created.</p>
     *
     * @param name collection name.
     * @param spec declared indexes, {@code null} for none.
     * @return future completed with the collection once all its indexes exist.
     */
    public CompletableFuture<MongoCollection<Document>> createCollection(final String name, final CollectionSpec spec) {
        final CollectionSpec collectionSpec = spec == null ? CollectionSpec.empty() : spec;
        return CompletableFuture
                .supplyAsync(() -> {
                    database.createCollection(name);
                    log.debug("Created collection {}.{}", database.getName(), name);
                    return database.getCollection(name);
                }, executor)
                .thenCompose(collection -> indexProvisioner
                        .ensureIndexes(collection, collectionSpec.getIndexes())
                        .thenApply(ignored -> collection));
    }

    /**
     * Drops a collection. Nothing else is cleaned up.
     */
    public CompletableFuture<Void> dropCollection(final String name) {
        return CompletableFuture.runAsync(() -> {
            database.getCollection(name).drop();
            log.debug("Dropped collection {}.{}", database.getName(), name);
        }, executor);
    }

    public MongoCollection<Document> getCollection(final String name) {
        return database.getCollection(name);
    }

    public MongoDatabase getDatabase() {
        return database;
    }

    @Override
    public void close() {
        mongoClient.close();
    }
}
