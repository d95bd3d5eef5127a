package com.novemberain.mongo.connection;

/**
 * Recognized configuration keys. Property files use them after a prefix,
 * e.g. {@code mongo.connection.poolSize}.
 */
public interface Constants {

  String URL = "url";
  String HOST = "host";
  String PORT = "port";
  String USER = "user";
  String PASSWORD = "password";
  String DATABASE = "database";

  String APP_NAME = "appname";
  String READ_PREFERENCE = "readPreference";
  String MAX_STALENESS_SECONDS = "maxStalenessSeconds";
  String READ_CONCERN = "readConcern";

  String SSL = "ssl";
  String TLS = "tls";
  String SSL_VALIDATE = "sslValidate";
  String CHECK_SERVER_IDENTITY = "checkServerIdentity";
  String SSL_CA = "sslCA";
  String SSL_CERT = "sslCert";
  String SSL_KEY = "sslKey";
  String SSL_PASS = "sslPass";
  String SSL_CRL = "sslCRL";
  String CIPHERS = "ciphers";

  String POOL_SIZE = "poolSize";
  String CONNECT_TIMEOUT_MS = "connectTimeoutMS";
  String SOCKET_TIMEOUT_MS = "socketTimeoutMS";
  String KEEP_ALIVE = "keepAlive";
  String KEEP_ALIVE_INITIAL_DELAY = "keepAliveInitialDelay";

  String REPLICA_SET = "replicaSet";
  String HA = "ha";
  String HA_INTERVAL = "haInterval";
  String SECONDARY_ACCEPTABLE_LATENCY_MS = "secondaryAcceptableLatencyMS";
  String ACCEPTABLE_LATENCY_MS = "acceptableLatencyMS";

  String W = "w";
  String J = "j";
  String WTIMEOUT = "wtimeout";
  String AUTH_SOURCE = "authSource";

  String PROMOTE_VALUES = "promoteValues";
  String PROMOTE_BUFFERS = "promoteBuffers";
  String PROMOTE_LONGS = "promoteLongs";
  String RAW = "raw";
  String IGNORE_UNDEFINED = "ignoreUndefined";
  String SERIALIZE_FUNCTIONS = "serializeFunctions";
  String FORCE_SERVER_OBJECT_ID = "forceServerObjectId";

  String SCHEME = "mongodb://";
  String DEFAULT_DATABASE = "admin";
}
