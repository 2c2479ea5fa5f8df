package com.tracker.exchange.mexc;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * MEXC futures request signing: lowercase hex HMAC-SHA256 of
 * {@code apiKey + requestTime + sortedQueryString}, keyed with the secret.
 */
public final class MexcSigner {

    private final String apiKey;
    private final SecretKeySpec keySpec;

    public MexcSigner(String apiKey, String secretKey) {
        this.apiKey = apiKey;
        this.keySpec = new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
    }

    public String apiKey() {
        return apiKey;
    }

    public String sign(String requestTime, String queryString) {
        return hmacHex(apiKey + requestTime + queryString);
    }

    /**
     * Parameters joined as {@code k=v&k=v} in key order; empty for no parameters.
     */
    public static String queryString(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        return new TreeMap<>(params).entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining("&"));
    }

    String hmacHex(String message) {
        try {
            Mac hmac = Mac.getInstance("HmacSHA256");
            hmac.init(keySpec);
            byte[] digest = hmac.doFinal(message.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
