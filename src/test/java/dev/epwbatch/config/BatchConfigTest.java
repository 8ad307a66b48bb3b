package dev.epwbatch.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.File;

import static org.junit.jupiter.api.Assertions.*;

class BatchConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("epw.maxWorkers");
        System.clearProperty("epw.cacheEnabled");
        System.clearProperty("epw.indexType");
    }

    @Test
    void defaults() {
        BatchConfig config = new BatchConfig();
        assertEquals(4, config.getMaxWorkers());
        assertEquals(10_000, config.getChunkSize());
        assertEquals(5, config.getReclaimEveryChunks());
        assertTrue(config.isCacheEnabled());
        assertEquals(200, config.getCacheMaxSizeMB());
        assertEquals(24 * 3600, config.getCacheDefaultTtlSeconds());
        assertEquals(7 * 24 * 3600, config.getProcessedCacheTtlSeconds());
        assertEquals(IndexType.JSON_FILE, config.getIndexType());
        assertEquals(3, config.getDownloadMaxAttempts());
    }

    @Test
    void systemProperties_overrideDefaults_andBadValuesFallBack() {
        System.setProperty("epw.maxWorkers", "12");
        System.setProperty("epw.cacheEnabled", "false");
        System.setProperty("epw.indexType", "NOT_A_TYPE");

        BatchConfig config = new BatchConfig();
        assertEquals(12, config.getMaxWorkers());
        assertFalse(config.isCacheEnabled());
        assertEquals(IndexType.JSON_FILE, config.getIndexType());

        System.setProperty("epw.maxWorkers", "many");
        assertEquals(4, new BatchConfig().getMaxWorkers());
    }

    @Test
    void chainedSetters_andCacheDir() {
        BatchConfig config = new BatchConfig().setDataDir("base").setMaxWorkers(2);
        assertEquals(2, config.getMaxWorkers());
        assertEquals("base" + File.separator + "cache", config.getCacheDir());
    }
}
