package com.novemberain.mongo.connection.db;

import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;

/**
 * Connect primitive of the driver. {@link ConnectionBuilder} calls it once per build.
 */
public interface MongoClientFactory {

    /**
     * Factory backed by {@link MongoClients#create(MongoClientSettings)}.
     */
    MongoClientFactory DEFAULT = MongoClients::create;

    /**
     * @param settings fully resolved client settings.
     * @return a client; implementations may throw any {@link com.mongodb.MongoException}.
     */
    MongoClient create(MongoClientSettings settings);
}
