package com.metarwatch.collectors.metar;

/**
 * Anything that can supply the latest raw report for a station.
 */
@FunctionalInterface
public interface MetarSource {
    /**
     * @throws ReportUnavailableException when no report can be produced for the station
     */
    FetchedReport fetch(String station);
}
