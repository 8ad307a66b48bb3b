package dev.epwbatch.error;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EpwBatchExceptionTest {

    @Test
    void describe_includesCodeMessageAndContext() {
        DownloadException e = new DownloadException("HTTP 404", "http://example.invalid/260", "260", 2023, 404);
        assertEquals(ErrorKind.DOWNLOAD, e.getKind());
        assertEquals("[DOWNLOAD_ERROR] HTTP 404 | Context: url=http://example.invalid/260, station_id=260, "
                + "year=2023, http_status=404", e.describe());
    }

    @Test
    void nullContextValues_areDropped() {
        DownloadException e = new DownloadException("timeout", "http://example.invalid", null, null, 0);
        assertEquals(Map.of("url", "http://example.invalid"), e.getContext());
        assertEquals("[DOWNLOAD_ERROR] timeout | Context: url=http://example.invalid", e.describe());
    }

    @Test
    void withoutContext_describeIsCodeAndMessage() {
        assertEquals("[PROCESSING_ERROR] boom", new ProcessingException("boom", null).describe());
    }

    @Test
    void everySubclass_carriesItsKind() {
        assertEquals(ErrorKind.CONFIGURATION, new ConfigurationException("x").getKind());
        assertEquals(ErrorKind.STATION, new StationException("x", "260", "find").getKind());
        assertEquals(ErrorKind.VALIDATION, new DataValidationException("x").getKind());
        assertEquals(ErrorKind.PROCESSING, new ProcessingException("x", "260", 2023, "transform", null).getKind());
        assertEquals(ErrorKind.GENERATION, new GenerationException("x", "/o", "260", 2023, null).getKind());
        assertEquals(ErrorKind.CACHE, new CacheException("x", "/c", "open", null).getKind());
        assertEquals(ErrorKind.RESOURCE, new ResourceException("x", "memory", "10MB", "5MB").getKind());
        assertEquals("EPW_ERROR", ErrorKind.GENERATION.code());
    }

    @Test
    void configurationException_keepsInvalidKeys() {
        ConfigurationException e = new ConfigurationException("bad", "c.yaml", List.of("a.b"), null);
        assertEquals(List.of("a.b"), e.getInvalidKeys());
        assertEquals(List.of("a.b"), e.getContext().get("invalid_keys"));
    }
}
