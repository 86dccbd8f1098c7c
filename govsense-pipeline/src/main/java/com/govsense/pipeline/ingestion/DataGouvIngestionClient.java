package com.govsense.pipeline.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsense.pipeline.config.GovSenseProperties;
import com.govsense.pipeline.exception.SchemaMismatchException;
import com.govsense.pipeline.exception.SourceUnavailableException;
import com.govsense.pipeline.model.DatasetMetadata;
import com.govsense.pipeline.model.DatasetSpec;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.function.Supplier;

/**
 * Fetches dataset extracts from data.gouv.fr.
 *
 * A source locator that is not a URL is a dataset slug: its metadata is read
 * from {@code /datasets/{slug}/}, kept alongside the rows, and the first CSV
 * resource is downloaded.
 * Each HTTP call runs under the dataGouv retry policy; only transient failures
 * (I/O errors, timeouts, 429, 5xx) are retried.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DataGouvIngestionClient {

    private static final int MAX_DESCRIPTION = 2000;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Retry dataGouvRetry;
    private final CsvPayloadReader payloadReader;
    private final GovSenseProperties properties;

    /**
     * Download and decode one dataset. The returned rows are lazy and can be
     * consumed once; call again to re-fetch.
     */
    public FetchedDataset fetch(DatasetSpec spec) {
        DatasetMetadata metadata = spec.isDirectUrl() ? DatasetMetadata.of(spec, spec.getSource()) : describe(spec);
        byte[] payload = download(metadata.getResourceUrl());
        log.info("Dataset {}: downloaded {} bytes from {}", spec.getId(), payload.length, metadata.getResourceUrl());
        return new FetchedDataset(metadata, payloadReader.read(spec, payload));
    }

    /**
     * Read the data.gouv.fr catalogue entry of a slug-sourced dataset and pick
     * its first CSV resource.
     */
    public DatasetMetadata describe(DatasetSpec spec) {
        String slug = spec.getSource();
        String url = properties.getIngestion().getBaseUrl() + "/datasets/" + slug + "/";
        String body = withRetry(url, () -> {
            ResponseEntity<String> response = restTemplate.getForEntity(url, String.class);
            return response.getBody();
        });
        if (body == null || body.isBlank()) {
            throw new SchemaMismatchException("Empty metadata for dataset " + slug);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new SchemaMismatchException("Unreadable metadata for dataset " + slug, e);
        }

        String resourceUrl = firstCsvResource(root.path("resources"));
        if (resourceUrl == null) {
            throw new SourceUnavailableException("No CSV resource found for dataset " + slug, false, null);
        }
        log.debug("Dataset {} resolved to {}", slug, resourceUrl);

        return DatasetMetadata.builder()
                .datasetId(spec.getId())
                .sourceId(root.path("id").asText(null))
                .title(root.path("title").asText(spec.getDisplayName()))
                .slug(root.path("slug").asText(slug))
                .description(truncate(root.path("description").asText(null), MAX_DESCRIPTION))
                .organization(root.path("organization").path("name").asText(null))
                .license(root.path("license").asText(null))
                .lastModified(parseTimestamp(slug, root.path("last_modified").asText(null)))
                .resourceUrl(resourceUrl)
                .build();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private static String firstCsvResource(JsonNode resources) {
        for (JsonNode resource : resources) {
            String format = resource.path("format").asText("");
            String resourceUrl = resource.path("url").asText(null);
            if ("csv".equalsIgnoreCase(format.trim()) && resourceUrl != null) {
                return resourceUrl;
            }
        }
        return null;
    }

    // data.gouv.fr sends ISO-8601 with an offset; older entries omit it
    private static LocalDateTime parseTimestamp(String slug, String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text);
            } catch (DateTimeParseException ignored) {
                log.debug("Dataset {}: unparseable last_modified '{}'", slug, text);
                return null;
            }
        }
    }

    private static String truncate(String text, int max) {
        return text == null || text.length() <= max ? text : text.substring(0, max);
    }

    private byte[] download(String url) {
        byte[] payload = withRetry(url, () -> restTemplate.getForObject(url, byte[].class));
        if (payload == null) {
            throw new SchemaMismatchException("Empty response body from " + url);
        }
        return payload;
    }

    private <T> T withRetry(String url, Supplier<T> call) {
        return Retry.decorateSupplier(dataGouvRetry, () -> translate(url, call)).get();
    }

    private <T> T translate(String url, Supplier<T> call) {
        log.debug("GET {}", url);
        try {
            return call.get();

        } catch (HttpClientErrorException e) {
            boolean throttled = e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value();
            if (throttled) {
                log.warn("Rate limited (429) by {}", url);
            }
            throw new SourceUnavailableException("HTTP " + e.getStatusCode().value() + " from " + url,
                    throttled, e.getStatusCode().value(), e);

        } catch (HttpServerErrorException e) {
            throw new SourceUnavailableException("HTTP " + e.getStatusCode().value() + " from " + url,
                    true, e.getStatusCode().value(), e);

        } catch (ResourceAccessException e) {
            // connection refused, reset, read/connect timeout
            throw new SourceUnavailableException("I/O error calling " + url + ": " + e.getMessage(), true, null, e);

        } catch (RestClientException e) {
            throw new SourceUnavailableException("Call to " + url + " failed: " + e.getMessage(), false, null, e);
        }
    }
}
