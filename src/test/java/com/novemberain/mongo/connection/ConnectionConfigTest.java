package com.novemberain.mongo.connection;

import com.novemberain.mongo.connection.db.ConnectionOptions;
import org.junit.Test;

import java.util.Properties;

import static org.junit.Assert.*;

public class ConnectionConfigTest {

    private static final String PREFIX = "mongo.connection.";

    @Test
    public void shouldLoadPrefixedProperties() throws Exception {
        ConnectionConfig config = ConnectionConfig.load("connection.properties", PREFIX);

        assertNull(config.getUrl());
        assertEquals("db.example.com", config.getHost());
        assertEquals(Integer.valueOf(27018), config.getPort());
        assertEquals("reporting", config.getUser());
        assertEquals("s3cret", config.getPassword());
        assertEquals("orders", config.getDatabase());

        ConnectionOptions options = config.getOptions();
        assertEquals("admin", options.getAuthSource());
        assertEquals("rs0", options.getReplicaSet());
        assertEquals(Integer.valueOf(20), options.getPoolSize());
        assertEquals(Integer.valueOf(2000), options.getConnectTimeoutMillis());
        assertEquals(Integer.valueOf(30000), options.getSocketTimeoutMillis());
        assertEquals(Boolean.TRUE, options.getSsl());
        assertEquals(Boolean.FALSE, options.getSslValidate());
        assertEquals("majority", options.getWriteConcernW());
        assertEquals(Boolean.TRUE, options.getWriteConcernJournal());
        assertEquals(Integer.valueOf(5000), options.getWriteConcernTimeoutMillis());
        assertEquals("secondaryPreferred", options.getReadPreference());
        assertEquals("reporting-service", options.getAppName());
    }

    @Test
    public void shouldLeaveUnsetAndBlankOptionsNull() throws Exception {
        ConnectionOptions options = ConnectionConfig.load("connection.properties", PREFIX).getOptions();

        assertNull(options.getCiphers());
        assertNull(options.getHaIntervalMillis());
        assertNull(options.getPromoteLongs());
        assertNull(options.getSslCa());
    }

    @Test
    public void shouldReadUnprefixedProperties() throws Exception {
        Properties props = new Properties();
        props.setProperty("url", "mongodb://x/y?replicaSet=rs0");
        props.setProperty("keepAlive", "yes");
        props.setProperty("haInterval", "10000");

        ConnectionConfig config = ConnectionConfig.fromProperties(props, null);

        assertEquals("mongodb://x/y?replicaSet=rs0", config.getUrl());
        assertEquals(Boolean.TRUE, config.getOptions().getKeepAlive());
        assertEquals(Integer.valueOf(10000), config.getOptions().getHaIntervalMillis());
    }

    @Test
    public void shouldRejectMalformedNumber() {
        Properties props = new Properties();
        props.setProperty(PREFIX + "poolSize", "ten");
        try {
            ConnectionConfig.fromProperties(props, PREFIX);
            fail("Expected ConnectionConfigException");
        } catch (ConnectionConfigException e) {
            assertEquals("'mongo.connection.poolSize' must be a non-negative integer, was 'ten'.", e.getMessage());
        }
    }

    @Test(expected = ConnectionConfigException.class)
    public void shouldRejectMalformedBoolean() throws Exception {
        Properties props = new Properties();
        props.setProperty(PREFIX + "ssl", "maybe");

        ConnectionConfig.fromProperties(props, PREFIX);
    }

    @Test(expected = ConnectionConfigException.class)
    public void shouldRejectOutOfRangeNumber() throws Exception {
        Properties props = new Properties();
        props.setProperty(PREFIX + "port", "99999999999");

        ConnectionConfig.fromProperties(props, PREFIX);
    }

    @Test(expected = ConnectionConfigException.class)
    public void shouldFailOnMissingResource() throws Exception {
        ConnectionConfig.load("missing.properties", PREFIX);
    }

    @Test
    public void shouldDefaultToEmptyOptions() {
        assertSame(ConnectionOptions.empty(), ConnectionConfig.builder().build().getOptions());
    }
}
