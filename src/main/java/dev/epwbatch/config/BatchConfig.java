package dev.epwbatch.config;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

@Getter
@Setter
@Accessors(chain = true)
public class BatchConfig {
    // System property helpers so tests and the CLI can override defaults (safe fallbacks)
    private static String prop(String key, String def) {
        String v = System.getProperty(key);
        return v == null ? def : v;
    }
    private static boolean boolProp(String key, boolean def) {
        String v = System.getProperty(key);
        return v == null ? def : Boolean.parseBoolean(v);
    }
    private static int intProp(String key, int def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Integer.parseInt(v); } catch (NumberFormatException e) { return def; }
    }
    private static long longProp(String key, long def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Long.parseLong(v); } catch (NumberFormatException e) { return def; }
    }
    private static IndexType indexTypeProp() {
        try { return IndexType.valueOf(prop("epw.indexType", "JSON_FILE")); }
        catch (IllegalArgumentException ignored) { return IndexType.JSON_FILE; }
    }

    // Paths
    private String dataDir = prop("epw.dataDir", "data");
    private String outputDir = prop("epw.outputDir", "output/epw");
    private String stationInfoFile = prop("epw.stationInfoFile", "data/stations/knmi_STN_infor.csv");

    // Batch behavior
    private int maxWorkers = intProp("epw.maxWorkers", 4);
    private int chunkSize = intProp("epw.chunkSize", 10_000);       // raw lines per streaming chunk
    private int reclaimEveryChunks = intProp("epw.reclaimEveryChunks", 5);
    private long memoryLimitMb = longProp("epw.memoryLimitMb", 0); // 0 = unlimited
    private String pipeline = prop("epw.pipeline", "");             // PipelineProvider name, empty = first found

    // Batch result cache
    private boolean cacheEnabled = boolProp("epw.cacheEnabled", true);
    private long cacheMaxSizeMB = longProp("epw.cacheMaxSizeMB", 200);
    private long cacheDefaultTtlSeconds = longProp("epw.cacheDefaultTtlSeconds", 24 * 3600);
    private IndexType indexType = indexTypeProp();

    // Processed table cache
    private long processedCacheMaxSizeMB = longProp("epw.processedCacheMaxSizeMB", 1000);
    private long processedCacheTtlSeconds = longProp("epw.processedCacheTtlSeconds", 7 * 24 * 3600);

    // Download retries
    private int downloadMaxAttempts = intProp("epw.downloadMaxAttempts", 3);
    private long retryBackoffMillis = longProp("epw.retryBackoffMillis", 1000);
    private double retryBackoffMultiplier = 2.0;

    /** Base directory holding one sub-directory per cache region. */
    public String getCacheDir() {
        return dataDir + java.io.File.separator + "cache";
    }
}
