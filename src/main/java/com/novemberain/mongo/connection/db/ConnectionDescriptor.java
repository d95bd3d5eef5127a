package com.novemberain.mongo.connection.db;

import com.novemberain.mongo.connection.util.ConnectionUrls;

/**
 * Connection target plus the options resolved for it.
 */
public final class ConnectionDescriptor {

    private final String target;
    private final ConnectionOptions options;

    public ConnectionDescriptor(String target, ConnectionOptions options) {
        this.target = target;
        this.options = options;
    }

    /**
     * @return connection string handed to the driver.
     */
    public String getTarget() {
        return target;
    }

    public ConnectionOptions getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return ConnectionUrls.maskPassword(target);
    }
}
