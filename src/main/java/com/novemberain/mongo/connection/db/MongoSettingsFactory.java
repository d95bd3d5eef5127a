package com.novemberain.mongo.connection.db;

import com.mongodb.AuthenticationMechanism;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.ReadConcern;
import com.mongodb.ReadConcernLevel;
import com.mongodb.ReadPreference;
import com.mongodb.WriteConcern;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static com.novemberain.mongo.connection.Constants.*;

/**
 * Translates resolved {@link ConnectionOptions} into {@link MongoClientSettings}.
 *
 * <p>The connection string is applied first; every option that is set overrides
 * what the connection string says.</p>
 */
public class MongoSettingsFactory {

    private static final Logger log = LoggerFactory.getLogger(MongoSettingsFactory.class);

    public MongoClientSettings create(final ConnectionString connectionString, final ConnectionOptions options,
                                      final SSLContext sslContext) {
        final MongoClientSettings.Builder settingsBuilder = MongoClientSettings.builder()
                .applyConnectionString(connectionString);

        if (options.getAppName() != null) {
            settingsBuilder.applicationName(options.getAppName());
        }
        applyPoolAndSocket(settingsBuilder, options);
        applyCluster(settingsBuilder, options);
        applyReadPreference(settingsBuilder, options);
        if (options.getReadConcern() != null) {
            settingsBuilder.readConcern(new ReadConcern(ReadConcernLevel.fromString(options.getReadConcern())));
        }
        applyWriteConcern(settingsBuilder, connectionString, options);
        applySsl(settingsBuilder, options, sslContext);
        applyAuthSource(settingsBuilder, connectionString, options);
        warnAboutUnsupported(options);

        return settingsBuilder.build();
    }

    private void applyPoolAndSocket(MongoClientSettings.Builder settingsBuilder, ConnectionOptions options) {
        final Integer poolSize = options.getPoolSize();
        if (poolSize != null) {
            settingsBuilder.applyToConnectionPoolSettings(builder -> builder.maxSize(poolSize));
        }
        final Integer connectTimeout = options.getConnectTimeoutMillis();
        if (connectTimeout != null) {
            settingsBuilder.applyToSocketSettings(builder -> builder.connectTimeout(connectTimeout, TimeUnit.MILLISECONDS));
        }
        final Integer socketTimeout = options.getSocketTimeoutMillis();
        if (socketTimeout != null) {
            settingsBuilder.applyToSocketSettings(builder -> builder.readTimeout(socketTimeout, TimeUnit.MILLISECONDS));
        }
        if (options.getKeepAlive() != null || options.getKeepAliveInitialDelay() != null) {
            // enabled by default,
            // ignored per MongoDB Java client deprecations
            log.debug("Socket keepAlive is always enabled by the driver, '{}'/'{}' ignored",
                    KEEP_ALIVE, KEEP_ALIVE_INITIAL_DELAY);
        }
    }

    private void applyCluster(MongoClientSettings.Builder settingsBuilder, ConnectionOptions options) {
        final String replicaSet = options.getReplicaSet();
        if (replicaSet != null) {
            settingsBuilder.applyToClusterSettings(builder -> builder.requiredReplicaSetName(replicaSet));
        }
        final Integer haInterval = options.getHaIntervalMillis();
        if (haInterval != null) {
            settingsBuilder.applyToServerSettings(builder -> builder.heartbeatFrequency(haInterval, TimeUnit.MILLISECONDS));
        }
        final Integer localThreshold = options.getSecondaryAcceptableLatencyMillis() != null
                ? options.getSecondaryAcceptableLatencyMillis()
                : options.getAcceptableLatencyMillis();
        if (localThreshold != null) {
            settingsBuilder.applyToClusterSettings(builder -> builder.localThreshold(localThreshold, TimeUnit.MILLISECONDS));
        }
    }

    private void applyReadPreference(MongoClientSettings.Builder settingsBuilder, ConnectionOptions options) {
        final String name = options.getReadPreference();
        if (name == null) {
            if (options.getMaxStalenessSeconds() != null) {
                log.warn("'{}' has no effect without '{}'", MAX_STALENESS_SECONDS, READ_PREFERENCE);
            }
            return;
        }
        if (options.getMaxStalenessSeconds() == null) {
            settingsBuilder.readPreference(ReadPreference.valueOf(name));
        } else {
            settingsBuilder.readPreference(ReadPreference.valueOf(name, Collections.emptyList(),
                    options.getMaxStalenessSeconds(), TimeUnit.SECONDS));
        }
    }

    private void applyWriteConcern(MongoClientSettings.Builder settingsBuilder, ConnectionString connectionString,
                                   ConnectionOptions options) {
        if (options.getWriteConcernW() == null && options.getWriteConcernJournal() == null
                && options.getWriteConcernTimeoutMillis() == null) {
            return;
        }
        WriteConcern writeConcern = connectionString.getWriteConcern() != null
                ? connectionString.getWriteConcern()
                : WriteConcern.ACKNOWLEDGED;
        final String w = options.getWriteConcernW();
        if (w != null) {
            writeConcern = NumberUtils.isDigits(w)
                    ? writeConcern.withW(Integer.parseInt(w))
                    : writeConcern.withW(w);
        }
        if (options.getWriteConcernJournal() != null) {
            writeConcern = writeConcern.withJournal(options.getWriteConcernJournal());
        }
        if (options.getWriteConcernTimeoutMillis() != null) {
            writeConcern = writeConcern.withWTimeout(options.getWriteConcernTimeoutMillis(), TimeUnit.MILLISECONDS);
        }
        settingsBuilder.writeConcern(writeConcern);
    }

    private void applySsl(MongoClientSettings.Builder settingsBuilder, ConnectionOptions options, SSLContext sslContext) {
        final boolean invalidHostNameAllowed = Boolean.FALSE.equals(options.getCheckServerIdentity())
                || Boolean.FALSE.equals(options.getSslValidate());
        // TLS material alone never turns TLS on
        final Boolean ssl = options.getSsl();
        if (Boolean.TRUE.equals(ssl)) {
            settingsBuilder.applyToSslSettings(builder -> builder.enabled(true));
            if (sslContext != null) {
                settingsBuilder.applyToSslSettings(builder -> builder.context(sslContext));
            }
        } else if (ssl != null) {
            settingsBuilder.applyToSslSettings(builder -> builder.enabled(false));
        }
        if (invalidHostNameAllowed) {
            settingsBuilder.applyToSslSettings(builder -> builder.invalidHostNameAllowed(true));
        }
    }

    private void applyAuthSource(MongoClientSettings.Builder settingsBuilder, ConnectionString connectionString,
                                 ConnectionOptions options) {
        final MongoCredential credential = connectionString.getCredential();
        final String authSource = options.getAuthSource();
        if (credential == null || authSource == null || authSource.equals(credential.getSource())) {
            return;
        }
        final AuthenticationMechanism mechanism = credential.getAuthenticationMechanism();
        final MongoCredential rebuilt;
        if (mechanism == null) {
            rebuilt = MongoCredential.createCredential(credential.getUserName(), authSource, credential.getPassword());
        } else if (mechanism == AuthenticationMechanism.SCRAM_SHA_1) {
            rebuilt = MongoCredential.createScramSha1Credential(credential.getUserName(), authSource, credential.getPassword());
        } else if (mechanism == AuthenticationMechanism.SCRAM_SHA_256) {
            rebuilt = MongoCredential.createScramSha256Credential(credential.getUserName(), authSource, credential.getPassword());
        } else {
            log.warn("'{}' ignored for authentication mechanism {}", AUTH_SOURCE, mechanism);
            return;
        }
        settingsBuilder.credential(rebuilt);
    }

    private void warnAboutUnsupported(ConnectionOptions options) {
        final Map<String, Object> unsupported = new LinkedHashMap<>();
        unsupported.put(CIPHERS, options.getCiphers());
        unsupported.put(HA, options.getHa());
        unsupported.put(PROMOTE_VALUES, options.getPromoteValues());
        unsupported.put(PROMOTE_BUFFERS, options.getPromoteBuffers());
        unsupported.put(PROMOTE_LONGS, options.getPromoteLongs());
        unsupported.put(RAW, options.getRaw());
        unsupported.put(IGNORE_UNDEFINED, options.getIgnoreUndefined());
        unsupported.put(SERIALIZE_FUNCTIONS, options.getSerializeFunctions());
        unsupported.put(FORCE_SERVER_OBJECT_ID, options.getForceServerObjectId());
        for (Map.Entry<String, Object> entry : unsupported.entrySet()) {
            if (entry.getValue() != null) {
                log.warn("Option '{}' = {} is not supported by the Java driver and will be ignored",
                        entry.getKey(), entry.getValue());
            }
        }
    }
}
