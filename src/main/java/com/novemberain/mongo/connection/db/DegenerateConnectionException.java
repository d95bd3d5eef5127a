package com.novemberain.mongo.connection.db;

import com.mongodb.MongoClientException;

/**
 * The driver reported a successful connect but handed back no usable handle.
 */
public class DegenerateConnectionException extends MongoClientException {

    private static final long serialVersionUID = 1L;

    public DegenerateConnectionException(String message) {
        super(message);
    }
}
