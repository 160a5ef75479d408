package com.metarwatch.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Builds the shared client used for report fetches. A private truststore can be supplied
 * through {@code TRUSTSTORE_PATH} and {@code TRUSTSTORE_PASSWORD}; {@code TRUSTSTORE_TYPE}
 * overrides the type guessed from the file extension.
 */
public final class HttpClientFactory {
    static final String PATH_VARIABLE = "TRUSTSTORE_PATH";
    static final String PASSWORD_VARIABLE = "TRUSTSTORE_PASSWORD";
    static final String TYPE_VARIABLE = "TRUSTSTORE_TYPE";
    private static final Logger LOGGER = Logger.getLogger(HttpClientFactory.class.getName());

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        String truststorePath = environment.get(PATH_VARIABLE);
        if (truststorePath != null && !truststorePath.isBlank()) {
            builder.sslContext(sslContext(Path.of(truststorePath), environment));
        }
        return builder.build();
    }

    private static SSLContext sslContext(Path path, Map<String, String> environment) {
        String password = environment.get(PASSWORD_VARIABLE);
        if (password == null) {
            throw new IllegalStateException(PASSWORD_VARIABLE + " must be set when " + PATH_VARIABLE + " is configured");
        }
        if (!Files.exists(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }

        String type = environment.getOrDefault(TYPE_VARIABLE, truststoreType(path));
        try (InputStream in = Files.newInputStream(path)) {
            KeyStore trustStore = KeyStore.getInstance(type);
            trustStore.load(in, password.toCharArray());

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, tmf.getTrustManagers(), new SecureRandom());
            LOGGER.info(() -> "Using " + type + " truststore " + path);
            return sslContext;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }

    static String truststoreType(Path path) {
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (lower.endsWith(".p12") || lower.endsWith(".pfx") || lower.endsWith(".pkcs12")) {
            return "PKCS12";
        }
        return "JKS";
    }
}
