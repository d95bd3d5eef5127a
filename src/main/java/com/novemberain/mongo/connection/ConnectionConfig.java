package com.novemberain.mongo.connection;

import com.novemberain.mongo.connection.db.ConnectionOptions;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import static com.novemberain.mongo.connection.Constants.*;

/**
 * Configuration of a single MongoDB connection: either a complete {@code url},
 * or discrete host/port/credential/database fields, plus driver options.
 */
public final class ConnectionConfig {

    private final String url;
    private final String host;
    private final Integer port;
    private final String user;
    private final String password;
    private final String database;
    private final ConnectionOptions options;

    private ConnectionConfig(Builder b) {
        this.url = b.url;
        this.host = b.host;
        this.port = b.port;
        this.user = b.user;
        this.password = b.password;
        this.database = b.database;
        this.options = b.options == null ? ConnectionOptions.empty() : b.options;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads the configuration from a properties file on the classpath.
     *
     * @param resource classpath resource name.
     * @param prefix   key prefix, e.g. {@code "mongo.connection."}; may be empty.
     * @return loaded configuration.
     * @throws ConnectionConfigException if the resource is missing, unreadable or holds invalid values.
     */
    public static ConnectionConfig load(final String resource, final String prefix) throws ConnectionConfigException {
        final Properties props = new Properties();
        try (InputStream is = ConnectionConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new ConnectionConfigException("Configuration resource not found: " + resource);
            }
            props.load(is);
        } catch (IOException e) {
            throw new ConnectionConfigException("Cannot read configuration resource: " + resource, e);
        }
        return fromProperties(props, prefix);
    }

    /**
     * Reads every recognized key under {@code prefix}. Other keys are ignored.
     */
    public static ConnectionConfig fromProperties(final Properties props, final String prefix)
            throws ConnectionConfigException {
        final PropertyReader r = new PropertyReader(props, StringUtils.defaultString(prefix));

        final ConnectionOptions options = ConnectionOptions.builder()
                .withAppName(r.string(APP_NAME))
                .withReadPreference(r.string(READ_PREFERENCE))
                .withMaxStalenessSeconds(r.integer(MAX_STALENESS_SECONDS))
                .withReadConcern(r.string(READ_CONCERN))
                .withSsl(r.bool(SSL))
                .withSslValidate(r.bool(SSL_VALIDATE))
                .withCheckServerIdentity(r.bool(CHECK_SERVER_IDENTITY))
                .withSslCa(r.string(SSL_CA))
                .withSslCert(r.string(SSL_CERT))
                .withSslKey(r.string(SSL_KEY))
                .withSslPass(r.string(SSL_PASS))
                .withSslCrl(r.string(SSL_CRL))
                .withCiphers(r.string(CIPHERS))
                .withPoolSize(r.integer(POOL_SIZE))
                .withConnectTimeoutMillis(r.integer(CONNECT_TIMEOUT_MS))
                .withSocketTimeoutMillis(r.integer(SOCKET_TIMEOUT_MS))
                .withKeepAlive(r.bool(KEEP_ALIVE))
                .withKeepAliveInitialDelay(r.integer(KEEP_ALIVE_INITIAL_DELAY))
                .withReplicaSet(r.string(REPLICA_SET))
                .withHa(r.bool(HA))
                .withHaIntervalMillis(r.integer(HA_INTERVAL))
                .withSecondaryAcceptableLatencyMillis(r.integer(SECONDARY_ACCEPTABLE_LATENCY_MS))
                .withAcceptableLatencyMillis(r.integer(ACCEPTABLE_LATENCY_MS))
                .withWriteConcernW(r.string(W))
                .withWriteConcernJournal(r.bool(J))
                .withWriteConcernTimeoutMillis(r.integer(WTIMEOUT))
                .withAuthSource(r.string(AUTH_SOURCE))
                .withPromoteValues(r.bool(PROMOTE_VALUES))
                .withPromoteBuffers(r.bool(PROMOTE_BUFFERS))
                .withPromoteLongs(r.bool(PROMOTE_LONGS))
                .withRaw(r.bool(RAW))
                .withIgnoreUndefined(r.bool(IGNORE_UNDEFINED))
                .withSerializeFunctions(r.bool(SERIALIZE_FUNCTIONS))
                .withForceServerObjectId(r.bool(FORCE_SERVER_OBJECT_ID))
                .build();

        return builder()
                .withUrl(r.string(URL))
                .withHost(r.string(HOST))
                .withPort(r.integer(PORT))
                .withCredentials(r.string(USER), r.string(PASSWORD))
                .withDatabase(r.string(DATABASE))
                .withOptions(options)
                .build();
    }

    public String getUrl() {
        return url;
    }

    public String getHost() {
        return host;
    }

    public Integer getPort() {
        return port;
    }

    public String getUser() {
        return user;
    }

    public String getPassword() {
        return password;
    }

    public String getDatabase() {
        return database;
    }

    public ConnectionOptions getOptions() {
        return options;
    }

    public static final class Builder {

        private String url;
        private String host;
        private Integer port;
        private String user;
        private String password;
        private String database;
        private ConnectionOptions options;

        private Builder() {
        }

        public ConnectionConfig build() {
            return new ConnectionConfig(this);
        }

        // mutators below

        public Builder withUrl(final String url) {
            this.url = url;
            return this;
        }

        public Builder withHost(final String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(final Integer port) {
            this.port = port;
            return this;
        }

        public Builder withCredentials(final String user, final String password) {
            this.user = user;
            this.password = password;
            return this;
        }

        public Builder withDatabase(final String database) {
            this.database = database;
            return this;
        }

        public Builder withOptions(final ConnectionOptions options) {
            this.options = options;
            return this;
        }
    }

    /**
     * Typed access to prefixed properties. Blank values read as absent.
     */
    private static final class PropertyReader {

        private final Properties props;
        private final String prefix;

        PropertyReader(Properties props, String prefix) {
            this.props = props;
            this.prefix = prefix;
        }

        String string(String key) {
            return StringUtils.trimToNull(props.getProperty(prefix + key));
        }

        Integer integer(String key) throws ConnectionConfigException {
            final String value = string(key);
            if (value == null) {
                return null;
            }
            if (!NumberUtils.isDigits(value)) {
                throw new ConnectionConfigException(
                        String.format("'%s%s' must be a non-negative integer, was '%s'.", prefix, key, value));
            }
            try {
                return Integer.valueOf(value);
            } catch (NumberFormatException e) {
                throw new ConnectionConfigException(
                        String.format("'%s%s' is out of range: '%s'.", prefix, key, value), e);
            }
        }

        Boolean bool(String key) throws ConnectionConfigException {
            final String value = string(key);
            if (value == null) {
                return null;
            }
            final Boolean parsed = BooleanUtils.toBooleanObject(value);
            if (parsed == null) {
                throw new ConnectionConfigException(
                        String.format("'%s%s' must be a boolean, was '%s'.", prefix, key, value));
            }
            return parsed;
        }
    }
}
