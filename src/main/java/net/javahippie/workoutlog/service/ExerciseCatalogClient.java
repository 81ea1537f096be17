package net.javahippie.workoutlog.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.workoutlog.exception.CatalogImportException;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;

/**
 * Fetches exercise catalogs published as JSON.
 * Only reads over the network, the store is never touched here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExerciseCatalogClient {

    private final RestTemplate restTemplate;

    /**
     * Download a catalog payload.
     *
     * @param url http(s) location of a JSON array of exercise definitions
     * @return the raw payload
     * @throws IllegalArgumentException if the url is not http(s)
     * @throws CatalogImportException   on timeout, connection failure, HTTP error or empty body
     */
    public String fetchCatalog(String url) {
        URI uri = parseUrl(url);
        log.info("Fetching exercise catalog from {}", uri);

        long start = System.currentTimeMillis();
        try {
            String body = restTemplate.getForObject(uri, String.class);
            if (body == null || body.isBlank()) {
                throw new CatalogImportException("Catalog at " + uri + " returned an empty response");
            }
            log.debug("Fetched {} characters from {} in {}ms", body.length(), uri, System.currentTimeMillis() - start);
            return body;
        } catch (HttpStatusCodeException e) {
            log.warn("Catalog request to {} failed with status {}", uri, e.getStatusCode());
            throw new CatalogImportException("Catalog request failed with status " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.warn("Catalog request to {} failed: {}", uri, e.getMessage());
            throw new CatalogImportException("Could not reach catalog at " + uri + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new CatalogImportException("Failed to fetch catalog from " + uri, e);
        }
    }

    private static URI parseUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Catalog URL is required");
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid catalog URL: " + url, e);
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Catalog URL must use http or https: " + url);
        }
        return uri;
    }
}
