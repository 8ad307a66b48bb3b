package dev.epwbatch.cli;

import dev.epwbatch.batch.BatchOptions;
import dev.epwbatch.batch.BatchProcessor;
import dev.epwbatch.batch.BatchReport;
import dev.epwbatch.batch.BatchStats;
import dev.epwbatch.batch.WorkItem;
import dev.epwbatch.client.CacheClient;
import dev.epwbatch.config.BatchConfig;
import dev.epwbatch.config.ConfigLoader;
import dev.epwbatch.error.ConfigurationException;
import dev.epwbatch.pipeline.PipelineCollaborators;
import dev.epwbatch.pipeline.PipelineProviders;
import dev.epwbatch.station.StationMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * {@code epw-batch generate}: converts one year for the given stations, or for every known station.
 */
@Command(
        name = "generate",
        description = "Generate EPW files for one year.",
        mixinStandardHelpOptions = true)
public class GenerateCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(GenerateCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = "--year", required = true, paramLabel = "YEAR", description = "Year to process")
    private int year;

    @Option(names = "--stations", split = ",", paramLabel = "ID",
            description = "Comma-separated station ids (default: all stations)")
    private List<String> stations;

    @Option(names = "--sequential", description = "Process items one after another")
    private boolean sequential;

    @Option(names = "--workers", paramLabel = "N", description = "Maximum parallel workers")
    private Integer workers;

    @Option(names = "--force-download", description = "Ignore cached results and raw files")
    private boolean forceDownload;

    @Option(names = "--no-streaming", description = "Transform whole files instead of chunks")
    private boolean noStreaming;

    @Option(names = "--disable-cache", description = "Run without the result caches")
    private boolean disableCache;

    @Option(names = "--output-dir", paramLabel = "DIR", description = "Output directory for EPW files")
    private Path outputDir;

    @Option(names = "--config", paramLabel = "FILE", description = "YAML or JSON configuration file")
    private Path configFile;

    @Option(names = "--pipeline", paramLabel = "NAME", description = "Pipeline provider name")
    private String pipelineName;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        BatchConfig config;
        PipelineCollaborators collaborators;
        try {
            config = ConfigLoader.loadOrDefault(configFile);
            if (outputDir != null) config.setOutputDir(outputDir.toString());
            if (workers != null) config.setMaxWorkers(workers);
            if (disableCache) config.setCacheEnabled(false);
            if (pipelineName != null) config.setPipeline(pipelineName);
            ConfigLoader.validate(config, configFile == null ? "command line" : configFile.toString());
            collaborators = PipelineProviders.find(config.getPipeline()).create(config);
        } catch (ConfigurationException e) {
            logger.error("Configuration error: {}", e.describe());
            spec.commandLine().getErr().println(e.describe());
            return EpwBatchCommand.EXIT_CONFIG_ERROR;
        }

        List<String> ids = stations != null && !stations.isEmpty()
                ? stations
                : collaborators.stations().all().stream().map(StationMeta::stationId).collect(Collectors.toList());

        BatchOptions options = new BatchOptions()
                .setParallel(!sequential)
                .setMaxWorkers(workers)
                .setForceRefresh(forceDownload)
                .setStreaming(!noStreaming)
                .setProgressListener((completed, total, result) ->
                        logger.info("Progress: {}/{} - {} {}", completed, total, result.key(),
                                result.success() ? "OK" : "FAILED"));

        BatchReport report;
        try (CacheClient caches = new CacheClient(config)) {
            report = BatchProcessor.create(config, collaborators, caches)
                    .processBatch(WorkItem.forYear(ids, year), options);
        }

        BatchStats stats = report.stats();
        out.printf("Processed %d items: %d successful, %d failed%n", stats.total(), stats.successful(), stats.failed());
        out.printf("Total time: %.2fs, records: %d, cache hits: %d, misses: %d%n",
                stats.totalTime().toNanos() / 1e9, stats.totalDataRecords(), stats.cacheHits(), stats.cacheMisses());
        if (!report.failures().isEmpty()) {
            out.println("Failed:");
            report.failures().forEach((key, message) -> out.printf("  %s: %s%n", key, message));
        }
        out.flush();
        return report.anySucceeded() ? EpwBatchCommand.EXIT_OK : EpwBatchCommand.EXIT_ALL_FAILED;
    }
}
