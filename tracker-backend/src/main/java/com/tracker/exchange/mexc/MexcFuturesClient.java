package com.tracker.exchange.mexc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracker.config.TrackerConfig;
import com.tracker.core.exchange.ExchangeGateway;
import com.tracker.core.exchange.FetchException;
import com.tracker.core.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MEXC futures REST client: signed open-positions query and the public contract ticker.
 */
public final class MexcFuturesClient implements ExchangeGateway {
    private static final Logger logger = LoggerFactory.getLogger(MexcFuturesClient.class);

    static final String OPEN_POSITIONS_PATH = "/api/v1/private/position/open_positions";
    static final String TICKER_PATH = "/api/v1/contract/ticker";

    private static final TypeReference<List<MexcPosition>> POSITION_LIST = new TypeReference<>() {
    };

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final MexcSigner signer;
    private final String baseUrl;
    private final String displayName;
    private final Duration requestTimeout;
    private final Clock clock;

    public MexcFuturesClient(TrackerConfig config) {
        this(HttpClient.newBuilder().connectTimeout(config.requestTimeout()).build(),
            new ObjectMapper(),
            new MexcSigner(config.apiKey(), config.secretKey()),
            config.baseUrl(),
            config.exchangeName(),
            config.requestTimeout(),
            Clock.systemUTC());
    }

    MexcFuturesClient(HttpClient httpClient, ObjectMapper objectMapper, MexcSigner signer,
                      String baseUrl, String displayName, Duration requestTimeout, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.signer = signer;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.displayName = displayName;
        this.requestTimeout = requestTimeout;
        this.clock = clock;

        String key = signer.apiKey();
        logger.info("📡 MEXC futures client initialized for {} (API Key: {}...)",
            this.baseUrl, key.substring(0, Math.min(6, key.length())));
    }

    @Override
    public String name() {
        return displayName;
    }

    @Override
    public List<Position> fetchPositions() throws FetchException {
        String body = send(signedGet(OPEN_POSITIONS_PATH, Map.of()), OPEN_POSITIONS_PATH);
        return parsePositions(body);
    }

    @Override
    public double fetchReferencePrice(String symbol) throws FetchException {
        var request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + TICKER_PATH + "?symbol=" + URLEncoder.encode(symbol, StandardCharsets.UTF_8)))
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .GET()
            .build();
        return parseTicker(send(request, TICKER_PATH), symbol);
    }

    HttpRequest signedGet(String path, Map<String, String> params) {
        String requestTime = String.valueOf(clock.millis());
        String query = MexcSigner.queryString(params);
        String url = baseUrl + path + (query.isEmpty() ? "" : "?" + query);

        return HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(requestTimeout)
            .header("ApiKey", signer.apiKey())
            .header("Request-Time", requestTime)
            .header("Signature", signer.sign(requestTime, query))
            .header("Content-Type", "application/json")
            .GET()
            .build();
    }

    private String send(HttpRequest request, String endpoint) throws FetchException {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new FetchException("Request error for " + endpoint + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Request interrupted for " + endpoint, e);
        }

        if (response.statusCode() != 200) {
            throw new FetchException("MEXC API error: " + response.statusCode() + " - " + response.body());
        }
        logger.debug("MEXC API call successful: {}", endpoint);
        return response.body();
    }

    /**
     * Parse an open_positions envelope. Unusable records are skipped; a failed envelope throws.
     */
    List<Position> parsePositions(String body) throws FetchException {
        JsonNode data = dataOf(body, OPEN_POSITIONS_PATH);
        if (data == null || data.isNull()) {
            return List.of();
        }
        if (!data.isArray()) {
            throw new FetchException("Unexpected open_positions payload: data is " + data.getNodeType());
        }

        List<MexcPosition> raw;
        try {
            raw = objectMapper.convertValue(data, POSITION_LIST);
        } catch (IllegalArgumentException e) {
            throw new FetchException("Malformed open_positions payload: " + e.getMessage(), e);
        }

        var positions = new ArrayList<Position>(raw.size());
        for (MexcPosition p : raw) {
            MexcPositionMapper.toPosition(p).ifPresent(positions::add);
        }
        return positions;
    }

    double parseTicker(String body, String symbol) throws FetchException {
        JsonNode data = dataOf(body, TICKER_PATH);
        double lastPrice = Optional.ofNullable(data)
            .map(d -> d.path("lastPrice"))
            .filter(n -> n.isNumber() || n.isTextual())
            .map(JsonNode::asDouble)
            .orElse(0.0);
        if (lastPrice <= 0) {
            throw new FetchException("No lastPrice in ticker response for " + symbol);
        }
        return lastPrice;
    }

    private JsonNode dataOf(String body, String endpoint) throws FetchException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FetchException("Invalid JSON from " + endpoint + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.path("success").asBoolean(false)) {
            String code = root == null ? "?" : root.path("code").asText("?");
            String message = root == null ? "" : root.path("message").asText("");
            throw new FetchException("MEXC rejected " + endpoint + " (code " + code + ") " + message);
        }
        return root.get("data");
    }
}
