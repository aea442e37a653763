package com.upsearch.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Downloads source archives over HTTP(S).
 *
 * <p>Relative locations are resolved against the base URL; absolute {@code http(s)://}
 * locations are fetched as given. Both the connect and the whole request are bounded by
 * the configured timeout so a stalled server fails the fetch instead of hanging the run.
 */
public class HttpSourceFetcher implements SourceFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpSourceFetcher.class);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;

    public HttpSourceFetcher(String baseUrl, Duration timeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(),
            baseUrl, timeout);
    }

    HttpSourceFetcher(HttpClient httpClient, String baseUrl, Duration timeout) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
    }

    @Override
    public byte[] fetch(String location) {
        URI uri = resolve(location);
        log.info("Downloading {}", uri);

        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .GET()
            .build();

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new FetchFailedException(location, "Download failed for " + uri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchFailedException(location, "Download interrupted for " + uri, e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new FetchFailedException(location, "HTTP " + response.statusCode() + " from " + uri);
        }

        byte[] body = response.body();
        log.info("Downloaded {} bytes from {}", body.length, uri);
        return body;
    }

    URI resolve(String location) {
        if (location.startsWith("http://") || location.startsWith("https://")) {
            return URI.create(location);
        }
        String path = location.startsWith("/") ? location.substring(1) : location;
        return URI.create(baseUrl + "/" + path);
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
