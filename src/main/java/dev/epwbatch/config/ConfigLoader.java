package dev.epwbatch.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dev.epwbatch.error.ConfigurationException;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads a {@link BatchConfig} from a YAML ({@code .yml}/{@code .yaml}) or JSON file.
 *
 * <p>The file is split into {@code paths}, {@code processing}, {@code cache} and {@code retry}
 * sections with snake_case keys. Absent keys keep the defaults of {@link BatchConfig};
 * unknown keys are ignored.
 */
public final class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {}

    public static BatchConfig load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ConfigurationException("Configuration file not found: " + file,
                    file == null ? null : file.toString(), null);
        }
        ObjectMapper mapper = mapperFor(file);
        ConfigFile parsed;
        try {
            parsed = mapper.readValue(file.toFile(), ConfigFile.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse configuration file: " + e.getMessage(),
                    file.toString(), e);
        }
        BatchConfig config = new BatchConfig();
        if (parsed != null) {
            apply(parsed, config);
        }
        validate(config, file.toString());
        logger.info("Loaded configuration from {}", file);
        return config;
    }

    /**
     * Returns the defaults when {@code file} is null, otherwise {@link #load(Path)}.
     */
    public static BatchConfig loadOrDefault(Path file) {
        if (file == null) {
            BatchConfig config = new BatchConfig();
            validate(config, null);
            return config;
        }
        return load(file);
    }

    /**
     * Checks value ranges and throws a {@link ConfigurationException} naming every offending key.
     */
    public static void validate(BatchConfig config, String source) {
        List<String> invalid = new ArrayList<>();
        if (config.getMaxWorkers() < 1) invalid.add("processing.max_workers");
        if (config.getChunkSize() < 1) invalid.add("processing.chunk_size");
        if (config.getReclaimEveryChunks() < 1) invalid.add("processing.reclaim_every_chunks");
        if (config.getMemoryLimitMb() < 0) invalid.add("processing.memory_limit_mb");
        if (config.getCacheMaxSizeMB() < 1) invalid.add("cache.max_size_mb");
        if (config.getCacheDefaultTtlSeconds() < 1) invalid.add("cache.default_ttl_seconds");
        if (config.getProcessedCacheMaxSizeMB() < 1) invalid.add("cache.processed_max_size_mb");
        if (config.getProcessedCacheTtlSeconds() < 1) invalid.add("cache.processed_ttl_seconds");
        if (config.getIndexType() == null) invalid.add("cache.index_type");
        if (config.getDownloadMaxAttempts() < 1) invalid.add("retry.max_attempts");
        if (config.getRetryBackoffMillis() < 0) invalid.add("retry.backoff_millis");
        if (config.getRetryBackoffMultiplier() < 1.0) invalid.add("retry.backoff_multiplier");
        if (isBlank(config.getDataDir())) invalid.add("paths.data_dir");
        if (isBlank(config.getOutputDir())) invalid.add("paths.epw_output_dir");
        if (!invalid.isEmpty()) {
            throw new ConfigurationException("Invalid configuration values: " + invalid, source, invalid, null);
        }
    }

    private static ObjectMapper mapperFor(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper;
        if (name.endsWith(".yml") || name.endsWith(".yaml")) {
            mapper = new ObjectMapper(new YAMLFactory());
        } else if (name.endsWith(".json")) {
            mapper = new ObjectMapper();
        } else {
            throw new ConfigurationException("Unsupported config file format: " + name, file.toString(), null);
        }
        return mapper
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private static void apply(ConfigFile file, BatchConfig config) {
        Paths paths = file.getPaths();
        if (paths != null) {
            if (paths.getDataDir() != null) config.setDataDir(paths.getDataDir());
            if (paths.getEpwOutputDir() != null) config.setOutputDir(paths.getEpwOutputDir());
            if (paths.getStationInfoFile() != null) config.setStationInfoFile(paths.getStationInfoFile());
        }
        Processing processing = file.getProcessing();
        if (processing != null) {
            if (processing.getMaxWorkers() != null) config.setMaxWorkers(processing.getMaxWorkers());
            if (processing.getChunkSize() != null) config.setChunkSize(processing.getChunkSize());
            if (processing.getCacheEnabled() != null) config.setCacheEnabled(processing.getCacheEnabled());
            if (processing.getReclaimEveryChunks() != null) config.setReclaimEveryChunks(processing.getReclaimEveryChunks());
            if (processing.getMemoryLimitMb() != null) config.setMemoryLimitMb(processing.getMemoryLimitMb());
            if (processing.getPipeline() != null) config.setPipeline(processing.getPipeline());
        }
        Cache cache = file.getCache();
        if (cache != null) {
            if (cache.getMaxSizeMb() != null) config.setCacheMaxSizeMB(cache.getMaxSizeMb());
            if (cache.getDefaultTtlSeconds() != null) config.setCacheDefaultTtlSeconds(cache.getDefaultTtlSeconds());
            if (cache.getProcessedMaxSizeMb() != null) config.setProcessedCacheMaxSizeMB(cache.getProcessedMaxSizeMb());
            if (cache.getProcessedTtlSeconds() != null) config.setProcessedCacheTtlSeconds(cache.getProcessedTtlSeconds());
            if (cache.getIndexType() != null) config.setIndexType(cache.getIndexType());
        }
        Retry retry = file.getRetry();
        if (retry != null) {
            if (retry.getMaxAttempts() != null) config.setDownloadMaxAttempts(retry.getMaxAttempts());
            if (retry.getBackoffMillis() != null) config.setRetryBackoffMillis(retry.getBackoffMillis());
            if (retry.getBackoffMultiplier() != null) config.setRetryBackoffMultiplier(retry.getBackoffMultiplier());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    @Getter
    @Setter
    static class ConfigFile {
        private Paths paths;
        private Processing processing;
        private Cache cache;
        private Retry retry;
    }

    @Getter
    @Setter
    static class Paths {
        private String dataDir;
        private String epwOutputDir;
        private String stationInfoFile;
    }

    @Getter
    @Setter
    static class Processing {
        private Integer maxWorkers;
        private Integer chunkSize;
        private Boolean cacheEnabled;
        private Integer reclaimEveryChunks;
        private Long memoryLimitMb;
        private String pipeline;
    }

    @Getter
    @Setter
    static class Cache {
        private Long maxSizeMb;
        private Long defaultTtlSeconds;
        private Long processedMaxSizeMb;
        private Long processedTtlSeconds;
        private IndexType indexType;
    }

    @Getter
    @Setter
    static class Retry {
        private Integer maxAttempts;
        private Long backoffMillis;
        private Double backoffMultiplier;
    }
}
