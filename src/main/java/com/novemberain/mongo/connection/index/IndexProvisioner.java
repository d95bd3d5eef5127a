package com.novemberain.mongo.connection.index;

import com.mongodb.client.MongoCollection;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ensures declared indexes exist on a collection.
 *
 * <p>All index requests are submitted at once. The result fails as soon as any
 * request fails, with that request's exception; requests already submitted
 * keep running and are not rolled back.</p>
 */
public class IndexProvisioner {

    private static final Logger log = LoggerFactory.getLogger(IndexProvisioner.class);

    private final Executor executor;

    public IndexProvisioner(Executor executor) {
        this.executor = executor;
    }

    /**
     * @param collection target collection.
     * @param indexes    index declarations, may be {@code null} or empty.
     * @return future completed when every index exists, or failed with the first error.
     */
    public CompletableFuture<Void> ensureIndexes(final MongoCollection<Document> collection,
                                                 final List<IndexSpec> indexes) {
        if (indexes == null || indexes.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        final CompletableFuture<Void> result = new CompletableFuture<>();
        final AtomicInteger remaining = new AtomicInteger(indexes.size());

        for (final IndexSpec index : indexes) {
            CompletableFuture
                    .supplyAsync(() -> collection.createIndex(index.getKeys(), index.getOptions()), executor)
                    .whenComplete((name, error) -> {
                        if (error != null) {
                            // first one wins, later failures are no-ops
                            result.completeExceptionally(unwrap(error));
                        } else {
                            log.debug("Index {} ensured on {}", name, collection.getNamespace());
                            if (remaining.decrementAndGet() == 0) {
                                result.complete(null);
                            }
                        }
                    });
        }
        return result;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
