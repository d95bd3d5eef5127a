package com.novemberain.mongo.connection.db;

/**
 * Driver-level options of a connection. Every field is optional; {@code null}
 * leaves the driver default in place.
 *
 * <p>Instances are immutable. Use {@link #toBuilder()} to derive a modified copy.</p>
 */
public final class ConnectionOptions {

    private static final ConnectionOptions EMPTY = builder().build();

    private final String appName;
    private final String readPreference;
    private final Integer maxStalenessSeconds;
    private final String readConcern;

    private final Boolean ssl;
    private final Boolean sslValidate;
    private final Boolean checkServerIdentity;
    private final String sslCa;
    private final String sslCert;
    private final String sslKey;
    private final String sslPass;
    private final String sslCrl;
    private final String ciphers;

    private final Integer poolSize;
    private final Integer connectTimeoutMillis;
    private final Integer socketTimeoutMillis;
    private final Boolean keepAlive;
    private final Integer keepAliveInitialDelay;

    private final String replicaSet;
    private final Boolean ha;
    private final Integer haIntervalMillis;
    private final Integer secondaryAcceptableLatencyMillis;
    private final Integer acceptableLatencyMillis;

    private final String writeConcernW;
    private final Boolean writeConcernJournal;
    private final Integer writeConcernTimeoutMillis;
    private final String authSource;

    private final Boolean promoteValues;
    private final Boolean promoteBuffers;
    private final Boolean promoteLongs;
    private final Boolean raw;
    private final Boolean ignoreUndefined;
    private final Boolean serializeFunctions;
    private final Boolean forceServerObjectId;

    private ConnectionOptions(Builder b) {
        this.appName = b.appName;
        this.readPreference = b.readPreference;
        this.maxStalenessSeconds = b.maxStalenessSeconds;
        this.readConcern = b.readConcern;
        this.ssl = b.ssl;
        this.sslValidate = b.sslValidate;
        this.checkServerIdentity = b.checkServerIdentity;
        this.sslCa = b.sslCa;
        this.sslCert = b.sslCert;
        this.sslKey = b.sslKey;
        this.sslPass = b.sslPass;
        this.sslCrl = b.sslCrl;
        this.ciphers = b.ciphers;
        this.poolSize = b.poolSize;
        this.connectTimeoutMillis = b.connectTimeoutMillis;
        this.socketTimeoutMillis = b.socketTimeoutMillis;
        this.keepAlive = b.keepAlive;
        this.keepAliveInitialDelay = b.keepAliveInitialDelay;
        this.replicaSet = b.replicaSet;
        this.ha = b.ha;
        this.haIntervalMillis = b.haIntervalMillis;
        this.secondaryAcceptableLatencyMillis = b.secondaryAcceptableLatencyMillis;
        this.acceptableLatencyMillis = b.acceptableLatencyMillis;
        this.writeConcernW = b.writeConcernW;
        this.writeConcernJournal = b.writeConcernJournal;
        this.writeConcernTimeoutMillis = b.writeConcernTimeoutMillis;
        this.authSource = b.authSource;
        this.promoteValues = b.promoteValues;
        this.promoteBuffers = b.promoteBuffers;
        this.promoteLongs = b.promoteLongs;
        this.raw = b.raw;
        this.ignoreUndefined = b.ignoreUndefined;
        this.serializeFunctions = b.serializeFunctions;
        this.forceServerObjectId = b.forceServerObjectId;
    }

    public static ConnectionOptions empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with every field of this instance.
     */
    public Builder toBuilder() {
        return new Builder()
                .withAppName(appName)
                .withReadPreference(readPreference)
                .withMaxStalenessSeconds(maxStalenessSeconds)
                .withReadConcern(readConcern)
                .withSsl(ssl)
                .withSslValidate(sslValidate)
                .withCheckServerIdentity(checkServerIdentity)
                .withSslCa(sslCa)
                .withSslCert(sslCert)
                .withSslKey(sslKey)
                .withSslPass(sslPass)
                .withSslCrl(sslCrl)
                .withCiphers(ciphers)
                .withPoolSize(poolSize)
                .withConnectTimeoutMillis(connectTimeoutMillis)
                .withSocketTimeoutMillis(socketTimeoutMillis)
                .withKeepAlive(keepAlive)
                .withKeepAliveInitialDelay(keepAliveInitialDelay)
                .withReplicaSet(replicaSet)
                .withHa(ha)
                .withHaIntervalMillis(haIntervalMillis)
                .withSecondaryAcceptableLatencyMillis(secondaryAcceptableLatencyMillis)
                .withAcceptableLatencyMillis(acceptableLatencyMillis)
                .withWriteConcernW(writeConcernW)
                .withWriteConcernJournal(writeConcernJournal)
                .withWriteConcernTimeoutMillis(writeConcernTimeoutMillis)
                .withAuthSource(authSource)
                .withPromoteValues(promoteValues)
                .withPromoteBuffers(promoteBuffers)
                .withPromoteLongs(promoteLongs)
                .withRaw(raw)
                .withIgnoreUndefined(ignoreUndefined)
                .withSerializeFunctions(serializeFunctions)
                .withForceServerObjectId(forceServerObjectId);
    }

    public String getAppName() {
        return appName;
    }

    public String getReadPreference() {
        return readPreference;
    }

    public Integer getMaxStalenessSeconds() {
        return maxStalenessSeconds;
    }

    public String getReadConcern() {
        return readConcern;
    }

    public Boolean getSsl() {
        return ssl;
    }

    public Boolean getSslValidate() {
        return sslValidate;
    }

    public Boolean getCheckServerIdentity() {
        return checkServerIdentity;
    }

    /**
     * @return path of a PEM file holding the trusted CA certificates.
     */
    public String getSslCa() {
        return sslCa;
    }

    /**
     * @return path of a PEM file holding the client certificate chain.
     */
    public String getSslCert() {
        return sslCert;
    }

    /**
     * @return path of a PEM file holding the client PKCS#8 private key.
     */
    public String getSslKey() {
        return sslKey;
    }

    public String getSslPass() {
        return sslPass;
    }

    /**
     * @return path of a PEM file holding certificate revocation lists.
     */
    public String getSslCrl() {
        return sslCrl;
    }

    public String getCiphers() {
        return ciphers;
    }

    public Integer getPoolSize() {
        return poolSize;
    }

    public Integer getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public Integer getSocketTimeoutMillis() {
        return socketTimeoutMillis;
    }

    public Boolean getKeepAlive() {
        return keepAlive;
    }

    public Integer getKeepAliveInitialDelay() {
        return keepAliveInitialDelay;
    }

    public String getReplicaSet() {
        return replicaSet;
    }

    public Boolean getHa() {
        return ha;
    }

    public Integer getHaIntervalMillis() {
        return haIntervalMillis;
    }

    public Integer getSecondaryAcceptableLatencyMillis() {
        return secondaryAcceptableLatencyMillis;
    }

    public Integer getAcceptableLatencyMillis() {
        return acceptableLatencyMillis;
    }

    public String getWriteConcernW() {
        return writeConcernW;
    }

    public Boolean getWriteConcernJournal() {
        return writeConcernJournal;
    }

    public Integer getWriteConcernTimeoutMillis() {
        return writeConcernTimeoutMillis;
    }

    public String getAuthSource() {
        return authSource;
    }

    public Boolean getPromoteValues() {
        return promoteValues;
    }

    public Boolean getPromoteBuffers() {
        return promoteBuffers;
    }

    public Boolean getPromoteLongs() {
        return promoteLongs;
    }

    public Boolean getRaw() {
        return raw;
    }

    public Boolean getIgnoreUndefined() {
        return ignoreUndefined;
    }

    public Boolean getSerializeFunctions() {
        return serializeFunctions;
    }

    public Boolean getForceServerObjectId() {
        return forceServerObjectId;
    }

    public static final class Builder {

        private String appName;
        private String readPreference;
        private Integer maxStalenessSeconds;
        private String readConcern;
        private Boolean ssl;
        private Boolean sslValidate;
        private Boolean checkServerIdentity;
        private String sslCa;
        private String sslCert;
        private String sslKey;
        private String sslPass;
        private String sslCrl;
        private String ciphers;
        private Integer poolSize;
        private Integer connectTimeoutMillis;
        private Integer socketTimeoutMillis;
        private Boolean keepAlive;
        private Integer keepAliveInitialDelay;
        private String replicaSet;
        private Boolean ha;
        private Integer haIntervalMillis;
        private Integer secondaryAcceptableLatencyMillis;
        private Integer acceptableLatencyMillis;
        private String writeConcernW;
        private Boolean writeConcernJournal;
        private Integer writeConcernTimeoutMillis;
        private String authSource;
        private Boolean promoteValues;
        private Boolean promoteBuffers;
        private Boolean promoteLongs;
        private Boolean raw;
        private Boolean ignoreUndefined;
        private Boolean serializeFunctions;
        private Boolean forceServerObjectId;

        private Builder() {
        }

        public ConnectionOptions build() {
            return new ConnectionOptions(this);
        }

        // mutators below

        public Builder withAppName(final String appName) {
            this.appName = appName;
            return this;
        }

        public Builder withReadPreference(final String readPreference) {
            this.readPreference = readPreference;
            return this;
        }

        public Builder withMaxStalenessSeconds(final Integer maxStalenessSeconds) {
            this.maxStalenessSeconds = maxStalenessSeconds;
            return this;
        }

        public Builder withReadConcern(final String readConcern) {
            this.readConcern = readConcern;
            return this;
        }

        public Builder withSsl(final Boolean ssl) {
            this.ssl = ssl;
            return this;
        }

        public Builder withSslValidate(final Boolean sslValidate) {
            this.sslValidate = sslValidate;
            return this;
        }

        public Builder withCheckServerIdentity(final Boolean checkServerIdentity) {
            this.checkServerIdentity = checkServerIdentity;
            return this;
        }

        public Builder withSslCa(final String sslCa) {
            this.sslCa = sslCa;
            return this;
        }

        public Builder withSslCert(final String sslCert) {
            this.sslCert = sslCert;
            return this;
        }

        public Builder withSslKey(final String sslKey) {
            this.sslKey = sslKey;
            return this;
        }

        public Builder withSslPass(final String sslPass) {
            this.sslPass = sslPass;
            return this;
        }

        public Builder withSslCrl(final String sslCrl) {
            this.sslCrl = sslCrl;
            return this;
        }

        public Builder withCiphers(final String ciphers) {
            this.ciphers = ciphers;
            return this;
        }

        public Builder withPoolSize(final Integer poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        public Builder withConnectTimeoutMillis(final Integer connectTimeoutMillis) {
            this.connectTimeoutMillis = connectTimeoutMillis;
            return this;
        }

        public Builder withSocketTimeoutMillis(final Integer socketTimeoutMillis) {
            this.socketTimeoutMillis = socketTimeoutMillis;
            return this;
        }

        public Builder withKeepAlive(final Boolean keepAlive) {
            this.keepAlive = keepAlive;
            return this;
        }

        public Builder withKeepAliveInitialDelay(final Integer keepAliveInitialDelay) {
            this.keepAliveInitialDelay = keepAliveInitialDelay;
            return this;
        }

        public Builder withReplicaSet(final String replicaSet) {
            this.replicaSet = replicaSet;
            return this;
        }

        public Builder withHa(final Boolean ha) {
            this.ha = ha;
            return this;
        }

        public Builder withHaIntervalMillis(final Integer haIntervalMillis) {
            this.haIntervalMillis = haIntervalMillis;
            return this;
        }

        public Builder withSecondaryAcceptableLatencyMillis(final Integer secondaryAcceptableLatencyMillis) {
            this.secondaryAcceptableLatencyMillis = secondaryAcceptableLatencyMillis;
            return this;
        }

        public Builder withAcceptableLatencyMillis(final Integer acceptableLatencyMillis) {
            this.acceptableLatencyMillis = acceptableLatencyMillis;
            return this;
        }

        public Builder withWriteConcernW(final String writeConcernW) {
            this.writeConcernW = writeConcernW;
            return this;
        }

        public Builder withWriteConcernJournal(final Boolean writeConcernJournal) {
            this.writeConcernJournal = writeConcernJournal;
            return this;
        }

        public Builder withWriteConcernTimeoutMillis(final Integer writeConcernTimeoutMillis) {
            this.writeConcernTimeoutMillis = writeConcernTimeoutMillis;
            return this;
        }

        public Builder withAuthSource(final String authSource) {
            this.authSource = authSource;
            return this;
        }

        public Builder withPromoteValues(final Boolean promoteValues) {
            this.promoteValues = promoteValues;
            return this;
        }

        public Builder withPromoteBuffers(final Boolean promoteBuffers) {
            this.promoteBuffers = promoteBuffers;
            return this;
        }

        public Builder withPromoteLongs(final Boolean promoteLongs) {
            this.promoteLongs = promoteLongs;
            return this;
        }

        public Builder withRaw(final Boolean raw) {
            this.raw = raw;
            return this;
        }

        public Builder withIgnoreUndefined(final Boolean ignoreUndefined) {
            this.ignoreUndefined = ignoreUndefined;
            return this;
        }

        public Builder withSerializeFunctions(final Boolean serializeFunctions) {
            this.serializeFunctions = serializeFunctions;
            return this;
        }

        public Builder withForceServerObjectId(final Boolean forceServerObjectId) {
            this.forceServerObjectId = forceServerObjectId;
            return this;
        }
    }
}
