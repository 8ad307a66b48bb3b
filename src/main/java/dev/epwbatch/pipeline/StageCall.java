package dev.epwbatch.pipeline;

@FunctionalInterface
public interface StageCall<T> {
    T call() throws Exception;
}
