package dev.epwbatch.pipeline;

@FunctionalInterface
public interface TableValidator {
    boolean validate(WeatherTable table);
}
