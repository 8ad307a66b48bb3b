package dev.epwbatch.error;

public class DataValidationException extends EpwBatchException {
    public DataValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public DataValidationException(String message, String validationType, Object value) {
        super(ErrorKind.VALIDATION, message, context("validation_type", validationType, "value", value), null);
    }
}
