package com.metarwatch.service.report;

import com.metarwatch.core.model.CloudLayer;
import com.metarwatch.core.model.StationObservation;
import com.metarwatch.core.model.Visibility;
import com.metarwatch.core.model.WeatherObservation;
import com.metarwatch.core.model.Wind;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a decoded observation for a monospaced console, one {@code label....value} line
 * per reported element.
 */
public final class ReportFormatter {
    public static final int DEFAULT_WIDTH = 30;
    private static final int OVERFLOW_DOTS = 2;
    private static final DateTimeFormatter OBSERVED_FORMAT =
            DateTimeFormatter.ofPattern("EEE MMM d, HH:mm z", Locale.US);

    private final Clock clock;
    private final ZoneId zone;
    private final int width;

    public ReportFormatter(Clock clock, ZoneId zone) {
        this(clock, zone, DEFAULT_WIDTH);
    }

    public ReportFormatter(Clock clock, ZoneId zone, int width) {
        this.clock = clock;
        this.zone = zone;
        this.width = width;
    }

    public String format(StationObservation report) {
        List<String> output = new ArrayList<>();
        output.add("Weather @ " + report.station());
        if (report.observedAt() != null) {
            output.add("Observed " + OBSERVED_FORMAT.format(report.observedAt().atZone(zone)));
        }
        output.addAll(lines(report));
        return String.join(System.lineSeparator(), output);
    }

    public List<String> lines(StationObservation report) {
        WeatherObservation obs = report.observation();
        List<String> lines = new ArrayList<>();
        if (report.observedAt() != null) {
            addLine(lines, "Age", ObservationAge.describe(report.observedAt(), clock.instant()));
        }
        addLine(lines, "Temperature", degrees(obs.temperatureF()));
        addLine(lines, "Wind Chill", degrees(obs.windChillF()));
        addLine(lines, "Heat Index", degrees(obs.heatIndexF()));
        addLine(lines, "Dew Point", degrees(obs.dewPointF()));
        addLine(lines, "Humidity", obs.relativeHumidityPercent() == null ? null : obs.relativeHumidityPercent() + "%");
        addLine(lines, "Pressure", pressure(obs.pressureInHg()));
        addLine(lines, "Wind", wind(obs.wind()));
        addLine(lines, "Visibility", visibility(obs.visibility()));
        addLine(lines, "Sky", sky(obs.cloudLayer()));
        addLine(lines, "Wx", obs.presentConditions());
        return lines;
    }

    String line(String label, String value) {
        int padding = width - label.length() - value.length();
        if (padding <= 0) {
            padding = OVERFLOW_DOTS;
        }
        return label + ".".repeat(padding) + value;
    }

    private void addLine(List<String> lines, String label, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        lines.add(line(label, value.trim()));
    }

    static String degrees(Integer fahrenheit) {
        return fahrenheit == null ? null : fahrenheit + "°F";
    }

    static String pressure(Double inHg) {
        return inHg == null ? null : String.format(Locale.ROOT, "%.2f in", inHg);
    }

    static String wind(Wind wind) {
        if (wind == null) {
            return null;
        }
        if (wind.isCalm() || wind.speedMph() == null) {
            return Wind.CALM;
        }
        String speed = wind.gustMph() == null
                ? String.valueOf(wind.speedMph())
                : wind.speedMph() + "/" + wind.gustMph();
        return wind.direction() + " " + speed + " mph";
    }

    static String visibility(Visibility visibility) {
        if (visibility == null) {
            return null;
        }
        String glyph = switch (visibility.qualifier()) {
            case AT_MOST -> "<";
            case AT_LEAST -> ">";
            case EXACT -> "";
        };
        String amount = BigDecimal.valueOf(visibility.value()).stripTrailingZeros().toPlainString();
        return glyph + amount + " " + visibility.unit();
    }

    static String sky(CloudLayer layer) {
        if (layer == null) {
            return null;
        }
        if (CloudLayer.VERTICAL_VISIBILITY.equals(layer.code()) && layer.altitudeFeet() != null) {
            return CloudLayer.VERTICAL_VISIBILITY + " " + layer.altitudeFeet() + " ft";
        }
        return layer.description();
    }
}
