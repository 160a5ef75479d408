package com.metarwatch.collectors.metar;

import java.time.Instant;

/**
 * A raw report as delivered by a {@link MetarSource}, before decoding.
 */
public record FetchedReport(String station, String rawText, Instant observedAt) {
}
