package com.metarwatch.collectors.metar;

public class ReportUnavailableException extends RuntimeException {
    public enum Reason {
        FILE_NOT_FOUND("File not found"),
        STATION_NOT_FOUND("Station not found");

        private final String label;

        Reason(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final String station;
    private final Reason reason;

    public ReportUnavailableException(String station, Reason reason) {
        this(station, reason, null);
    }

    public ReportUnavailableException(String station, Reason reason, Throwable cause) {
        super(reason.label() + ": " + station, cause);
        this.station = station;
        this.reason = reason;
    }

    public String station() {
        return station;
    }

    public Reason reason() {
        return reason;
    }
}
