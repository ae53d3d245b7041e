/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.sources;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.saleskernel.config.PipelineConfig;
import com.intuitivedesigns.saleskernel.core.SourceConnector;
import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One-shot REST extraction.
 * Issues a single GET (no retry) and decodes the JSON body into raw records.
 *
 * <ul>
 *   <li>JSON array: one record per object element; other elements are skipped with a warning.</li>
 *   <li>JSON object: wrapped into a single-record list.</li>
 *   <li>Anything else, or a non-2xx status: {@link ExtractionException}.</li>
 * </ul>
 */
public final class RestSourceConnector implements SourceConnector<Map<String, Object>> {

    private static final Logger log = LoggerFactory.getLogger(RestSourceConnector.class);

    public static final String KEY_URL = "source.rest.url";
    public static final String KEY_TIMEOUT_MS = "source.rest.timeout.ms";
    public static final long DEFAULT_TIMEOUT_MS = 10_000L;

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final URI targetUri;
    private final Duration timeout;
    private final MetricsRuntime metrics;
    private final ObjectMapper mapper;

    private HttpClient client;

    public RestSourceConnector(URI targetUri, Duration timeout, MetricsRuntime metrics) {
        this.targetUri = Objects.requireNonNull(targetUri, "targetUri");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.mapper = new ObjectMapper();
    }

    public static RestSourceConnector fromConfig(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");

        final String url = config.require(KEY_URL);
        final URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + KEY_URL + ": " + url, e);
        }
        if (uri.getScheme() == null || !uri.getScheme().startsWith("http")) {
            throw new IllegalArgumentException("Invalid " + KEY_URL + " (expected http/https): " + url);
        }

        final long timeoutMs = config.getLong(KEY_TIMEOUT_MS, DEFAULT_TIMEOUT_MS);
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException(KEY_TIMEOUT_MS + " must be > 0");
        }
        return new RestSourceConnector(uri, Duration.ofMillis(timeoutMs), metrics);
    }

    @Override
    public void connect() {
        if (client == null) {
            client = HttpClient.newBuilder()
                    .connectTimeout(timeout)
                    .followRedirects(HttpClient.Redirect.NORMAL)
                    .build();
        }
        log.info("🌎 REST Source Connected. Target: {} (timeout {}ms)", targetUri, timeout.toMillis());
    }

    @Override
    public void disconnect() {
        // HttpClient resources are managed by JVM (idle connection eviction)
        client = null;
        log.info("🌎 REST Source Disconnected.");
    }

    @Override
    public List<Map<String, Object>> fetchAll() throws ExtractionException {
        if (client == null) {
            throw new IllegalStateException("connect() must be called before fetchAll()");
        }

        log.info("Starting extraction from {}", targetUri);
        final HttpRequest request = HttpRequest.newBuilder()
                .uri(targetUri)
                .GET()
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("User-Agent", "SalesKernel/1.0")
                .build();

        final HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            metrics.counter("source.rest.fetch.error");
            throw new ExtractionException("Timeout after " + timeout.toMillis() + "ms calling " + targetUri, e);
        } catch (IOException e) {
            metrics.counter("source.rest.fetch.error");
            throw new ExtractionException("Connection error calling " + targetUri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException("Interrupted while calling " + targetUri, e);
        }

        final int status = response.statusCode();
        if (status < 200 || status >= 300) {
            metrics.counter("source.rest.fetch.error");
            throw new ExtractionException("HTTP " + status + " from " + targetUri);
        }
        log.info("API responded with HTTP {}", status);

        final List<Map<String, Object>> records = decode(response.body());
        metrics.counter("source.rest.records", records.size());
        log.info("Extracted {} records from API", records.size());
        return records;
    }

    List<Map<String, Object>> decode(String body) throws ExtractionException {
        final JsonNode root;
        try {
            root = mapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Response from " + targetUri + " is not valid JSON: " + e.getOriginalMessage(), e);
        }

        if (root == null || root.isMissingNode()) {
            throw new ExtractionException("Empty response body from " + targetUri);
        }
        if (root.isObject()) {
            log.warn("API returned a single object, not a list. Wrapping it in a list.");
            return List.of(mapper.convertValue(root, RECORD_TYPE));
        }
        if (!root.isArray()) {
            throw new ExtractionException("Unexpected JSON type from " + targetUri + ": " + root.getNodeType()
                    + ". Expected a list or an object.");
        }

        final List<Map<String, Object>> out = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode element : root) {
            if (element.isObject()) {
                out.add(mapper.convertValue(element, RECORD_TYPE));
            } else {
                log.warn("Skipping element {} of type {}: not a JSON object", index, element.getNodeType());
            }
            index++;
        }
        return out;
    }
}
