package com.tracker.exchange.mexc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw open-position record from {@code /api/v1/private/position/open_positions}.
 * Fields the venue may omit are boxed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MexcPosition(
    @JsonProperty("positionId") Long positionId,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("positionType") Integer positionType,   // 1 = long, 2 = short
    @JsonProperty("holdVol") Double holdVol,
    @JsonProperty("holdAvgPrice") Double holdAvgPrice,
    @JsonProperty("leverage") Double leverage
) {}
