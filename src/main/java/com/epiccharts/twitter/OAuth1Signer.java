package com.epiccharts.twitter;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds OAuth 1.0a (HMAC-SHA1) {@code Authorization} headers for user-context API calls.
 * <p>
 * Query parameters of the request URI and any form-encoded body parameters take part in the
 * signature. JSON and multipart bodies do not.
 */
public class OAuth1Signer {

    private static final String SIGNATURE_METHOD = "HMAC-SHA1";
    private static final String VERSION = "1.0";

    private final String consumerKey;
    private final String consumerSecret;
    private final String token;
    private final String tokenSecret;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public OAuth1Signer(TwitterProperties properties) {
        this(properties.getApiKey(), properties.getApiSecret(),
                properties.getAccessToken(), properties.getAccessSecret(), Clock.systemUTC());
    }

    OAuth1Signer(String consumerKey, String consumerSecret, String token, String tokenSecret, Clock clock) {
        this.consumerKey = consumerKey;
        this.consumerSecret = consumerSecret;
        this.token = token;
        this.tokenSecret = tokenSecret;
        this.clock = clock;
    }

    /**
     * Returns the full {@code Authorization} header value for a request.
     *
     * @param method     HTTP method, e.g. {@code GET}
     * @param uri        request URI including any query string
     * @param formParams form-encoded body parameters, empty for JSON or multipart bodies
     */
    public String authorizationHeader(String method, URI uri, Map<String, String> formParams) {
        String nonce = newNonce();
        String timestamp = String.valueOf(clock.instant().getEpochSecond());
        return authorizationHeader(method, uri, formParams, nonce, timestamp);
    }

    String authorizationHeader(String method, URI uri, Map<String, String> formParams,
                               String nonce, String timestamp) {
        Map<String, String> oauthParams = oauthParams(nonce, timestamp);
        String signature = signature(method, uri, formParams, oauthParams);
        oauthParams.put("oauth_signature", signature);

        var parts = new ArrayList<String>();
        for (var entry : new TreeMap<>(oauthParams).entrySet()) {
            parts.add(encode(entry.getKey()) + "=\"" + encode(entry.getValue()) + "\"");
        }
        return "OAuth " + String.join(", ", parts);
    }

    String signature(String method, URI uri, Map<String, String> formParams, Map<String, String> oauthParams) {
        var all = new ArrayList<String[]>();
        for (var entry : oauthParams.entrySet()) {
            all.add(new String[]{encode(entry.getKey()), encode(entry.getValue())});
        }
        for (String[] pair : queryParams(uri)) {
            all.add(new String[]{encode(pair[0]), encode(pair[1])});
        }
        for (var entry : formParams.entrySet()) {
            all.add(new String[]{encode(entry.getKey()), encode(entry.getValue())});
        }
        all.sort((a, b) -> a[0].equals(b[0]) ? a[1].compareTo(b[1]) : a[0].compareTo(b[0]));

        var paramString = new StringBuilder();
        for (String[] pair : all) {
            if (!paramString.isEmpty()) paramString.append('&');
            paramString.append(pair[0]).append('=').append(pair[1]);
        }

        String baseString = method.toUpperCase() + "&" + encode(baseUrl(uri)) + "&" + encode(paramString.toString());
        String signingKey = encode(consumerSecret) + "&" + encode(tokenSecret);

        try {
            Mac mac = Mac.getInstance("HmacSHA1");
            mac.init(new SecretKeySpec(signingKey.getBytes(StandardCharsets.UTF_8), "HmacSHA1"));
            byte[] raw = mac.doFinal(baseString.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(raw);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA1 unavailable", e);
        }
    }

    Map<String, String> oauthParams(String nonce, String timestamp) {
        var params = new HashMap<String, String>();
        params.put("oauth_consumer_key", consumerKey);
        params.put("oauth_nonce", nonce);
        params.put("oauth_signature_method", SIGNATURE_METHOD);
        params.put("oauth_timestamp", timestamp);
        params.put("oauth_token", token);
        params.put("oauth_version", VERSION);
        return params;
    }

    private String newNonce() {
        byte[] bytes = new byte[24];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes).replaceAll("[^A-Za-z0-9]", "");
    }

    private static String baseUrl(URI uri) {
        String scheme = uri.getScheme().toLowerCase();
        String host = uri.getHost().toLowerCase();
        int port = uri.getPort();
        boolean defaultPort = port == -1
                || ("https".equals(scheme) && port == 443)
                || ("http".equals(scheme) && port == 80);
        return scheme + "://" + host + (defaultPort ? "" : ":" + port) + uri.getRawPath();
    }

    private static List<String[]> queryParams(URI uri) {
        var result = new ArrayList<String[]>();
        String query = uri.getRawQuery();
        if (query == null || query.isEmpty()) {
            return result;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            result.add(new String[]{
                    URLDecoder.decode(key, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8)});
        }
        return result;
    }

    /**
     * RFC 3986 percent-encoding as OAuth 1.0a requires.
     */
    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }
}
