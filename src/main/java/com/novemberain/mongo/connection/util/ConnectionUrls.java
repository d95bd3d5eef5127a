package com.novemberain.mongo.connection.util;

import java.io.UnsupportedEncodingException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Helpers for MongoDB connection strings.
 */
public class ConnectionUrls {

    private static final String UTF_8 = "UTF-8";
    private static final Pattern USER_INFO = Pattern.compile("(://[^:/@]*):[^@/]*@");
    private static final Pattern PERCENT_ESCAPE = Pattern.compile("%[0-9A-Fa-f]{2}");

    private ConnectionUrls() {
    }

    /**
     * Parses the query part of a connection string. Both {@code &} and {@code ;}
     * separate options. A repeated key keeps its last value. A key or value with
     * a malformed escape is kept as given.
     *
     * @param url connection string, may be {@code null}.
     * @return decoded options in order of appearance, never {@code null}.
     */
    public static Map<String, String> queryParameters(String url) {
        if (url == null) {
            return Collections.emptyMap();
        }
        final int start = url.indexOf('?');
        if (start < 0 || start == url.length() - 1) {
            return Collections.emptyMap();
        }
        final Map<String, String> params = new LinkedHashMap<>();
        for (String pair : url.substring(start + 1).split("[&;]")) {
            if (pair.isEmpty()) {
                continue;
            }
            final int eq = pair.indexOf('=');
            if (eq < 0) {
                params.put(decode(pair), "");
            } else {
                params.put(decode(pair.substring(0, eq)), decode(pair.substring(eq + 1)));
            }
        }
        return params;
    }

    /**
     * Percent-encodes a user name or password for the user info part.
     *
     * <p>A value that already holds a {@code %XX} escape is taken as encoded and
     * returned unchanged, so {@code p%40ss} is not turned into {@code p%2540ss}.
     * A literal {@code %} followed by two hex digits therefore has to be given
     * encoded as {@code %25}.</p>
     */
    public static String encodeUserInfo(String value) {
        if (PERCENT_ESCAPE.matcher(value).find()) {
            return value;
        }
        try {
            return URLEncoder.encode(value, UTF_8).replace("+", "%20");
        } catch (UnsupportedEncodingException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Replaces the password of a connection string with asterisks, for logging.
     */
    public static String maskPassword(String url) {
        if (url == null) {
            return null;
        }
        return USER_INFO.matcher(url).replaceFirst("$1:****@");
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, UTF_8);
        } catch (UnsupportedEncodingException e) {
            throw new IllegalStateException(e);
        } catch (IllegalArgumentException e) {
            // malformed escape, kept raw for the driver to reject
            return value;
        }
    }
}
