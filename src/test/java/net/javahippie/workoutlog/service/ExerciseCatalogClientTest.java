package net.javahippie.workoutlog.service;

import net.javahippie.workoutlog.exception.CatalogImportException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ExerciseCatalogClient.
 */
@ExtendWith(MockitoExtension.class)
class ExerciseCatalogClientTest {

    private static final String URL = "https://example.org/catalogs/light.json";

    @Mock
    private RestTemplate restTemplate;

    @InjectMocks
    private ExerciseCatalogClient catalogClient;

    @Test
    @DisplayName("Should return the catalog body")
    void testFetchCatalog() {
        when(restTemplate.getForObject(URI.create(URL), String.class)).thenReturn("[]");

        assertEquals("[]", catalogClient.fetchCatalog(URL));
    }

    @Test
    @DisplayName("Timeouts should raise a catalog import error")
    void testFetchCatalog_Timeout() {
        when(restTemplate.getForObject(any(URI.class), eq(String.class)))
                .thenThrow(new ResourceAccessException("Read timed out", new SocketTimeoutException("Read timed out")));

        CatalogImportException exception = assertThrows(CatalogImportException.class,
                () -> catalogClient.fetchCatalog(URL));

        assertTrue(exception.getMessage().contains("Could not reach"));
    }

    @Test
    @DisplayName("HTTP errors should raise a catalog import error")
    void testFetchCatalog_HttpError() {
        when(restTemplate.getForObject(any(URI.class), eq(String.class)))
                .thenThrow(new HttpClientErrorException(HttpStatus.NOT_FOUND));

        CatalogImportException exception = assertThrows(CatalogImportException.class,
                () -> catalogClient.fetchCatalog(URL));

        assertTrue(exception.getMessage().contains("404"));
    }

    @Test
    @DisplayName("Empty responses should raise a catalog import error")
    void testFetchCatalog_EmptyBody() {
        when(restTemplate.getForObject(any(URI.class), eq(String.class))).thenReturn("  ");

        assertThrows(CatalogImportException.class, () -> catalogClient.fetchCatalog(URL));
    }

    @Test
    @DisplayName("Non-http URLs should be rejected without a request")
    void testFetchCatalog_InvalidUrl() {
        assertThrows(IllegalArgumentException.class, () -> catalogClient.fetchCatalog("file:///etc/passwd"));
        assertThrows(IllegalArgumentException.class, () -> catalogClient.fetchCatalog(""));
        verifyNoInteractions(restTemplate);
    }
}
