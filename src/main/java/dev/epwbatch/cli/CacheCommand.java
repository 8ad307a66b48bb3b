package dev.epwbatch.cli;

import dev.epwbatch.api.CacheStats;
import dev.epwbatch.api.CacheStore;
import dev.epwbatch.client.CacheClient;
import dev.epwbatch.config.BatchConfig;
import dev.epwbatch.config.ConfigLoader;
import dev.epwbatch.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ScopeType;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.function.ToIntFunction;

/**
 * {@code epw-batch cache stats|clear|purge}: inspects or maintains one cache region.
 */
@Command(
        name = "cache",
        description = "Inspect or maintain a cache region.",
        mixinStandardHelpOptions = true)
public class CacheCommand implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(CacheCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = "--region", defaultValue = CacheClient.BATCH_REGION, paramLabel = "NAME",
            scope = ScopeType.INHERIT, description = "Cache region (default: ${DEFAULT-VALUE})")
    private String region;

    @Option(names = "--config", paramLabel = "FILE", scope = ScopeType.INHERIT,
            description = "YAML or JSON configuration file")
    private Path configFile;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    @Command(name = "stats", description = "Show entry counts and size.")
    int stats() {
        return withCache(cache -> {
            CacheStats s = cache.stats();
            PrintWriter out = spec.commandLine().getOut();
            out.printf("Region: %s%n", region);
            out.printf("Entries: %d (%d valid, %d expired)%n", s.entryCount(), s.validCount(), s.expiredCount());
            out.printf("Size: %.2f MB of %.2f MB (%.1f%%)%n", s.totalMb(), s.maxMb(), s.usagePercent());
            out.flush();
            return EpwBatchCommand.EXIT_OK;
        });
    }

    @Command(name = "clear", description = "Remove every entry.")
    int clear() {
        return withCache(cache -> {
            int before = cache.stats().entryCount();
            cache.clear();
            spec.commandLine().getOut().printf("Cleared %d entries from region %s%n", before, region);
            spec.commandLine().getOut().flush();
            return EpwBatchCommand.EXIT_OK;
        });
    }

    @Command(name = "purge", description = "Remove expired entries only.")
    int purge() {
        return withCache(cache -> {
            int removed = cache.purgeExpired();
            spec.commandLine().getOut().printf("Purged %d expired entries from region %s%n", removed, region);
            spec.commandLine().getOut().flush();
            return EpwBatchCommand.EXIT_OK;
        });
    }

    private int withCache(ToIntFunction<CacheStore> action) {
        BatchConfig config;
        try {
            config = ConfigLoader.loadOrDefault(configFile);
        } catch (ConfigurationException e) {
            logger.error("Configuration error: {}", e.describe());
            spec.commandLine().getErr().println(e.describe());
            return EpwBatchCommand.EXIT_CONFIG_ERROR;
        }
        try (CacheClient caches = new CacheClient(config)) {
            return action.applyAsInt(caches.getCache(region));
        }
    }
}
