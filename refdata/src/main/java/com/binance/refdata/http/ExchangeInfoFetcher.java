package com.binance.refdata.http;

import com.binance.refdata.Config;
import com.binance.refdata.FetchException;
import com.binance.refdata.model.SegmentProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

public class ExchangeInfoFetcher {

    private static final Logger log = LoggerFactory.getLogger(ExchangeInfoFetcher.class);

    private final Config     config;
    private final HttpClient httpClient;
    private final Duration   timeout;

    public ExchangeInfoFetcher(Config config) {
        this.config     = config;
        this.timeout    = Duration.ofSeconds(config.httpTimeoutSec);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    /**
     * @return the response body
     * @throws FetchException on any status other than 200, or when no response arrives
     */
    public String fetch(SegmentProfile profile) {
        String endpoint = config.apiFor(profile) + profile.apiPath();
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint))
                    .timeout(timeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new FetchException("invalid endpoint '" + endpoint + "': " + e.getMessage(), e);
        }
        URI uri = request.uri();
        log.info("refdata.http_get url={}", uri);

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new FetchException("http request failed: " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("http request interrupted: " + uri, e);
        }

        if (response.statusCode() != 200) {
            throw new FetchException("http request failed: " + response.statusCode() + " " + uri,
                    response.statusCode());
        }
        return response.body();
    }

    public Path fetchTo(SegmentProfile profile, Path file) {
        String body = fetch(profile);
        log.info("refdata.writing_file path={} bytes={}", file, body.length());
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            return Files.writeString(file, body, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("failed writing " + file, e);
        }
    }
}
