package com.metarwatch.service.awc;

import com.metarwatch.collectors.metar.FetchedReport;
import com.metarwatch.collectors.metar.MetarSource;
import com.metarwatch.collectors.metar.ReportUnavailableException;
import com.metarwatch.collectors.metar.ReportUnavailableException.Reason;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fetches the latest report for a station from the Aviation Weather Center data API in its
 * XML form.
 */
public final class AviationWeatherClient implements MetarSource {
    public static final URI DEFAULT_ENDPOINT = URI.create("https://aviationweather.gov/api/data/metar");
    public static final String DEFAULT_USER_AGENT = "metar-watch/0.1";
    private static final Logger LOGGER = Logger.getLogger(AviationWeatherClient.class.getName());
    private static final int HOURS_BEFORE_NOW = 3;

    private final HttpClient httpClient;
    private final URI endpoint;
    private final Duration timeout;
    private final String userAgent;

    public AviationWeatherClient(HttpClient httpClient, URI endpoint, Duration timeout, String userAgent) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.timeout = timeout;
        this.userAgent = userAgent;
    }

    @Override
    public FetchedReport fetch(String station) {
        String stationId = station.trim().toUpperCase(Locale.ROOT);
        URI uri = URI.create(endpoint + "?ids=" + URLEncoder.encode(stationId, StandardCharsets.UTF_8)
                + "&format=xml&hours=" + HOURS_BEFORE_NOW);
        String body;
        try {
            body = getXml(uri);
        } catch (IOException | IllegalStateException e) {
            throw new ReportUnavailableException(stationId, Reason.FILE_NOT_FOUND, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReportUnavailableException(stationId, Reason.FILE_NOT_FOUND, e);
        }
        return parseResponse(stationId, body);
    }

    static FetchedReport parseResponse(String station, String xml) {
        Document document;
        try {
            document = newDocumentBuilder().parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        } catch (IOException | SAXException | ParserConfigurationException e) {
            throw new ReportUnavailableException(station, Reason.FILE_NOT_FOUND, e);
        }

        NodeList data = document.getElementsByTagName("data");
        if (data.getLength() == 0) {
            throw new ReportUnavailableException(station, Reason.FILE_NOT_FOUND);
        }
        Element dataElement = (Element) data.item(0);
        NodeList metars = dataElement.getElementsByTagName("METAR");
        if ("0".equals(dataElement.getAttribute("num_results").trim()) || metars.getLength() == 0) {
            throw new ReportUnavailableException(station, Reason.STATION_NOT_FOUND);
        }

        Element metar = (Element) metars.item(0);
        String rawText = childText(metar, "raw_text");
        String observationTime = childText(metar, "observation_time");
        try {
            Instant observedAt = observationTime.isEmpty() ? null : Instant.parse(observationTime);
            return new FetchedReport(station, rawText, observedAt);
        } catch (DateTimeParseException e) {
            throw new ReportUnavailableException(station, Reason.FILE_NOT_FOUND, e);
        }
    }

    private String getXml(URI uri) throws IOException, InterruptedException {
        int attempts = 0;
        while (true) {
            attempts++;
            HttpRequest request = HttpRequest.newBuilder(uri)
                    .GET()
                    .timeout(timeout)
                    .header("Accept", "application/xml,text/xml")
                    .header("User-Agent", userAgent)
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 == 2) {
                return response.body();
            }
            if (attempts >= 2 || response.statusCode() < 500) {
                throw new IllegalStateException("AWC request failed with status " + response.statusCode() + " for " + uri);
            }
            LOGGER.fine(() -> "Retrying " + uri + " after status " + response.statusCode());
        }
    }

    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setExpandEntityReferences(false);

        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException exception) {
                LOGGER.log(Level.FINE, "AWC response warning", exception);
            }

            @Override
            public void error(SAXParseException exception) throws SAXParseException {
                throw exception;
            }

            @Override
            public void fatalError(SAXParseException exception) throws SAXParseException {
                throw exception;
            }
        });
        return builder;
    }

    private static String childText(Element parent, String tagName) {
        NodeList children = parent.getElementsByTagName(tagName);
        if (children.getLength() == 0) {
            return "";
        }
        String text = children.item(0).getTextContent();
        return text == null ? "" : text.trim();
    }
}
