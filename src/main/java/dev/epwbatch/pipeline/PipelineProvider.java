package dev.epwbatch.pipeline;

import dev.epwbatch.config.BatchConfig;

/**
 * {@link java.util.ServiceLoader} service that builds pipeline collaborators from configuration.
 * Register implementations in {@code META-INF/services/dev.epwbatch.pipeline.PipelineProvider}.
 */
public interface PipelineProvider {
    String name();

    PipelineCollaborators create(BatchConfig config);
}
