package dev.epwbatch.pipeline;

import dev.epwbatch.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

public final class PipelineProviders {
    private static final Logger logger = LoggerFactory.getLogger(PipelineProviders.class);

    private PipelineProviders() {}

    /**
     * Finds a provider by name, or the first one on the classpath when {@code name} is blank.
     *
     * @throws ConfigurationException if no matching provider is registered
     */
    public static PipelineProvider find(String name) {
        List<String> seen = new ArrayList<>();
        for (PipelineProvider provider : ServiceLoader.load(PipelineProvider.class)) {
            seen.add(provider.name());
            if (name == null || name.isBlank() || provider.name().equals(name)) {
                logger.info("Using pipeline provider '{}'", provider.name());
                return provider;
            }
        }
        String wanted = name == null || name.isBlank() ? "<any>" : name;
        throw new ConfigurationException("No pipeline provider '" + wanted + "' on the classpath; available: " + seen);
    }
}
