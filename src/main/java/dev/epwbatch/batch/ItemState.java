package dev.epwbatch.batch;

/**
 * Stages a work item passes through. {@code DONE} and {@code FAILED} are terminal.
 */
enum ItemState {
    PENDING,
    CACHE_CHECK,
    CACHE_HIT,
    FETCHING,
    TRANSFORMING,
    VALIDATING,
    WRITING,
    DONE,
    FAILED
}
