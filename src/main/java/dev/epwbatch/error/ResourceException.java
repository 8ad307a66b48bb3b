package dev.epwbatch.error;

public class ResourceException extends EpwBatchException {
    public ResourceException(String message, String resourceType, String currentUsage, String limit) {
        super(ErrorKind.RESOURCE, message,
                context("resource_type", resourceType, "current_usage", currentUsage, "limit", limit), null);
    }
}
