package com.novemberain.mongo.connection.db;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import com.novemberain.mongo.connection.ConnectionConfig;
import com.novemberain.mongo.connection.ConnectionConfigException;
import com.novemberain.mongo.connection.MongoConnection;
import com.novemberain.mongo.connection.index.IndexProvisioner;
import com.novemberain.mongo.connection.util.ConnectionUrls;
import org.apache.commons.lang3.StringUtils;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import static com.novemberain.mongo.connection.Constants.*;

/**
 * Builder for {@link MongoConnection}.
 */
public class ConnectionBuilder {

    private static final Logger log = LoggerFactory.getLogger(ConnectionBuilder.class);

    static final String NO_DATABASE_OBJECT = "no database object returned";
    private static final Document PING = new Document("ping", 1);

    private ConnectionConfig config;
    private MongoClientFactory clientFactory = MongoClientFactory.DEFAULT;
    private MongoSettingsFactory settingsFactory = new MongoSettingsFactory();
    private SSLContextFactory sslContextFactory = new SSLContextFactory();
    private Executor executor = ForkJoinPool.commonPool();

    /**
     * Use {@link #builder()}.
     */
    private ConnectionBuilder() {
    }

    /**
     * Creates a builder.
     *
     * @return new builder instance.
     */
    public static ConnectionBuilder builder() {
        return new ConnectionBuilder();
    }

    /**
     * Opens a connection from current settings.
     *
     * <p>Configuration errors are thrown before anything touches the network.
     * Everything the driver reports, including a malformed connection string,
     * fails the returned future with the driver's own exception.</p>
     *
     * @return future completed with the connection once the server answered a ping.
     * @throws ConnectionConfigException if the configuration is invalid.
     */
    public CompletableFuture<MongoConnection> build() throws ConnectionConfigException {
        final ConnectionDescriptor descriptor = resolve();
        final SSLContext sslContext = createSSLContext(descriptor.getOptions());
        log.info("Connecting to MongoDB at {}", descriptor);
        return CompletableFuture.supplyAsync(() -> open(descriptor, sslContext), executor);
    }

    /**
     * Derives the connection target and the resolved options without any I/O.
     *
     * @throws ConnectionConfigException if credentials are given without a database.
     */
    public ConnectionDescriptor resolve() throws ConnectionConfigException {
        checkNotNull(config, "Connection config is required.");
        final ConnectionOptions candidate = config.getOptions();

        if (StringUtils.isNotEmpty(config.getUrl())) {
            return new ConnectionDescriptor(config.getUrl(), applyUrlOverrides(candidate, config.getUrl()));
        }
        return new ConnectionDescriptor(buildConnectionString(), candidate);
    }

    private ConnectionOptions applyUrlOverrides(ConnectionOptions candidate, String url) {
        final Map<String, String> query = ConnectionUrls.queryParameters(url);
        if (query.isEmpty()) {
            return candidate;
        }
        final ConnectionOptions.Builder resolved = candidate.toBuilder();
        // Atlas style URLs carry these in the query string, any ssl value turns TLS on
        if (StringUtils.isNotEmpty(query.get(SSL)) || StringUtils.isNotEmpty(query.get(TLS))) {
            resolved.withSsl(true);
        }
        if (StringUtils.isNotEmpty(query.get(AUTH_SOURCE))) {
            resolved.withAuthSource(query.get(AUTH_SOURCE));
        }
        if (StringUtils.isNotEmpty(query.get(REPLICA_SET))) {
            resolved.withReplicaSet(query.get(REPLICA_SET));
        }
        return resolved.build();
    }

    private String buildConnectionString() throws ConnectionConfigException {
        final StringBuilder connectionString = new StringBuilder(SCHEME);

        if (StringUtils.isNotEmpty(config.getUser()) && StringUtils.isNotEmpty(config.getPassword())) {
            if (StringUtils.isEmpty(config.getDatabase())) {
                throw new ConnectionConfigException(
                        "'Database name' is required if authentication is used.");
            }
            connectionString.append(ConnectionUrls.encodeUserInfo(config.getUser()))
                    .append(':')
                    .append(ConnectionUrls.encodeUserInfo(config.getPassword()))
                    .append('@');
        }

        // not validated, a missing host or port is reported by the driver
        connectionString.append(config.getHost()).append(':').append(config.getPort()).append('/');

        if (StringUtils.isNotEmpty(config.getDatabase())) {
            connectionString.append(config.getDatabase());
        }
        return connectionString.toString();
    }

    private SSLContext createSSLContext(ConnectionOptions options) throws ConnectionConfigException {
        try {
            return sslContextFactory.getSSLContext(options);
        } catch (SSLException e) {
            throw new ConnectionConfigException("Cannot setup SSL context", e);
        }
    }

    private MongoConnection open(ConnectionDescriptor descriptor, SSLContext sslContext) {
        final ConnectionString connectionString = new ConnectionString(descriptor.getTarget());
        final MongoClientSettings settings = settingsFactory.create(connectionString, descriptor.getOptions(), sslContext);

        final MongoClient client = clientFactory.create(settings);
        if (client == null) {
            throw new DegenerateConnectionException(NO_DATABASE_OBJECT);
        }
        final String dbName = StringUtils.defaultIfEmpty(connectionString.getDatabase(), DEFAULT_DATABASE);
        try {
            final MongoDatabase database = client.getDatabase(dbName);
            if (database == null) {
                throw new DegenerateConnectionException(NO_DATABASE_OBJECT);
            }
            database.runCommand(PING);
            log.info("Connected to MongoDB database '{}'", dbName);
            return new MongoConnection(client, database, new IndexProvisioner(executor), executor);
        } catch (RuntimeException e) {
            client.close();
            throw e;
        }
    }

    private static <T> T checkNotNull(final T reference, final String message) throws ConnectionConfigException {
        if (reference == null) {
            throw new ConnectionConfigException(message);
        }
        return reference;
    }

    // mutators below

    public ConnectionBuilder withConfig(final ConnectionConfig config) {
        this.config = config;
        return this;
    }

    public ConnectionBuilder withClientFactory(final MongoClientFactory clientFactory) {
        this.clientFactory = clientFactory;
        return this;
    }

    public ConnectionBuilder withSettingsFactory(final MongoSettingsFactory settingsFactory) {
        this.settingsFactory = settingsFactory;
        return this;
    }

    public ConnectionBuilder withSSLContextFactory(final SSLContextFactory sslContextFactory) {
        this.sslContextFactory = sslContextFactory;
        return this;
    }

    /**
     * Executor running every driver call of the connection, the default is the common pool.
     */
    public ConnectionBuilder withExecutor(final Executor executor) {
        this.executor = executor;
        return this;
    }
}
