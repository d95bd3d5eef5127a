package com.novemberain.mongo.connection.util;

import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class ConnectionUrlsTest {

    @Test
    public void shouldParseQueryParameters() {
        Map<String, String> params = ConnectionUrls.queryParameters(
                "mongodb+srv://u:p@cluster0.example.net/shop?ssl=true&authSource=admin;replicaSet=atlas-abc&retryWrites");

        assertEquals("true", params.get("ssl"));
        assertEquals("admin", params.get("authSource"));
        assertEquals("atlas-abc", params.get("replicaSet"));
        assertEquals("", params.get("retryWrites"));
    }

    @Test
    public void shouldDecodeQueryParameters() {
        assertEquals("my set", ConnectionUrls.queryParameters("mongodb://x/?replicaSet=my%20set").get("replicaSet"));
    }

    @Test
    public void shouldKeepMalformedEscapeAsGiven() {
        assertEquals("50%off", ConnectionUrls.queryParameters("mongodb://x/y?appName=50%off").get("appName"));
    }

    @Test
    public void shouldReturnEmptyMapWithoutQuery() {
        assertTrue(ConnectionUrls.queryParameters("mongodb://x/y").isEmpty());
        assertTrue(ConnectionUrls.queryParameters("mongodb://x/y?").isEmpty());
        assertTrue(ConnectionUrls.queryParameters(null).isEmpty());
    }

    @Test
    public void shouldMaskPassword() {
        assertEquals("mongodb://u:****@h:1/db", ConnectionUrls.maskPassword("mongodb://u:p@h:1/db"));
        assertEquals("mongodb://h:1/db", ConnectionUrls.maskPassword("mongodb://h:1/db"));
        assertNull(ConnectionUrls.maskPassword(null));
    }

    @Test
    public void shouldEncodeUserInfo() {
        assertEquals("p%40ss%3Aw%20rd", ConnectionUrls.encodeUserInfo("p@ss:w rd"));
    }

    @Test
    public void shouldNotEncodeAlreadyEncodedUserInfo() {
        assertEquals("p%40ss", ConnectionUrls.encodeUserInfo("p%40ss"));
        assertEquals("100%25%20sure", ConnectionUrls.encodeUserInfo("100%25%20sure"));
        assertEquals("50%25", ConnectionUrls.encodeUserInfo("50%"));
    }
}
