package com.pathfinder.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * Analysis request for one symbol. {@code closes} and {@code volumes} are oldest-first;
 * {@code volumes} may be null or empty.
 */
public record Context(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("closes") List<Double> closes,
    @JsonProperty("volumes") List<Double> volumes,
    @JsonProperty("traceId") String traceId
) {
    public PriceWindow toPriceWindow() {
        return PriceWindow.of(closes, volumes);
    }
}
