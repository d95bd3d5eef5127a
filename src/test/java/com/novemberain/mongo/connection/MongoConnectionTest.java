package com.novemberain.mongo.connection;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import com.novemberain.mongo.connection.index.CollectionSpec;
import com.novemberain.mongo.connection.index.IndexProvisioner;
import com.novemberain.mongo.connection.index.IndexSpec;
import org.bson.Document;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.InOrder;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

public class MongoConnectionTest {

    private static final Document SKU = new Document("sku", 1);

    private MongoClient client;
    private MongoDatabase database;
    private MongoCollection<Document> collection;
    private ExecutorService pool;

    @Before
    @SuppressWarnings("unchecked")
    public void setUp() {
        client = mock(MongoClient.class);
        database = mock(MongoDatabase.class);
        collection = mock(MongoCollection.class);
        when(database.getName()).thenReturn("shop");
        when(database.getCollection(anyString())).thenReturn(collection);
        pool = Executors.newFixedThreadPool(2);
    }

    @After
    public void tearDown() {
        pool.shutdownNow();
    }

    @Test
    public void shouldCreateCollectionThenItsIndexes() throws Exception {
        IndexOptions unique = new IndexOptions().unique(true);
        MongoConnection connection = connection(Runnable::run);

        CompletableFuture<MongoCollection<Document>> result =
                connection.createCollection("orders", CollectionSpec.of(IndexSpec.of(SKU, unique)));

        assertTrue(result.isDone());
        assertSame(collection, result.get());
        InOrder inOrder = inOrder(database, collection);
        inOrder.verify(database).createCollection("orders");
        inOrder.verify(collection).createIndex(SKU, unique);
    }

    @Test
    public void shouldCompleteOnlyAfterIndexesExist() throws Exception {
        MongoConnection connection = connection(pool);

        connection.createCollection("orders", CollectionSpec.fromDocument(
                Document.parse("{indexes: [{index: {sku: 1}, options: {unique: true}}]}")))
                .get(5, TimeUnit.SECONDS);

        verify(database).createCollection("orders");
        verify(collection).createIndex(any(Document.class), any(IndexOptions.class));
    }

    @Test
    public void shouldLeaveCollectionInPlaceWhenIndexFails() throws Exception {
        MongoException failure = new MongoException(85, "Index with name: sku_1 already exists with different options");
        when(collection.createIndex(any(Document.class), any(IndexOptions.class))).thenThrow(failure);
        MongoConnection connection = connection(Runnable::run);

        CompletableFuture<MongoCollection<Document>> result =
                connection.createCollection("orders", CollectionSpec.of(IndexSpec.of(SKU)));

        assertSame(failure, causeOf(result));
        verify(collection, never()).drop();
    }

    @Test
    public void shouldNotProvisionIndexesWhenCreateFails() throws Exception {
        MongoException exists = new MongoException(48, "Collection already exists. NS: shop.orders");
        doThrow(exists).when(database).createCollection("orders");
        MongoConnection connection = connection(Runnable::run);

        CompletableFuture<MongoCollection<Document>> result =
                connection.createCollection("orders", CollectionSpec.of(IndexSpec.of(SKU)));

        assertSame(exists, causeOf(result));
        verifyNoInteractions(collection);
    }

    @Test
    public void shouldAcceptMissingSpec() throws Exception {
        MongoConnection connection = connection(Runnable::run);

        assertSame(collection, connection.createCollection("orders", null).get());
        verify(collection, never()).createIndex(any(Document.class), any(IndexOptions.class));
    }

    @Test
    public void shouldDropCollection() throws Exception {
        connection(pool).dropCollection("orders").get(5, TimeUnit.SECONDS);

        verify(database).getCollection("orders");
        verify(collection).drop();
    }

    @Test
    public void shouldPropagateDropFailure() throws Exception {
        MongoException failure = new MongoException("not authorized on shop to execute command");
        doThrow(failure).when(collection).drop();

        assertSame(failure, causeOf(connection(Runnable::run).dropCollection("orders")));
    }

    @Test
    public void shouldCloseClient() {
        connection(Runnable::run).close();

        verify(client).close();
    }

    private MongoConnection connection(Executor executor) {
        return new MongoConnection(client, database, new IndexProvisioner(executor), executor);
    }

    private static Throwable causeOf(CompletableFuture<?> future) throws InterruptedException {
        try {
            future.get();
            fail("Expected the future to fail");
            return null;
        } catch (ExecutionException e) {
            return e.getCause();
        }
    }
}
