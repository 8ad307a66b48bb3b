package dev.epwbatch.pipeline;

import dev.epwbatch.error.EpwBatchException;
import dev.epwbatch.error.ErrorKind;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of a pipeline stage: either a value or an error kind with a message.
 *
 * @param <T> value type
 */
public final class Outcome<T> {
    private final T value;
    private final ErrorKind errorKind;
    private final String message;
    private final Throwable cause;

    private Outcome(T value, ErrorKind errorKind, String message, Throwable cause) {
        this.value = value;
        this.errorKind = errorKind;
        this.message = message;
        this.cause = cause;
    }

    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(value, null, null, null);
    }

    public static <T> Outcome<T> err(ErrorKind kind, String message) {
        return err(kind, message, null);
    }

    public static <T> Outcome<T> err(ErrorKind kind, String message, Throwable cause) {
        Objects.requireNonNull(kind, "kind cannot be null");
        return new Outcome<>(null, kind, message == null ? kind.code() : message, cause);
    }

    /**
     * Runs one stage and classifies any failure.
     * <ul>
     *   <li>{@link EpwBatchException}: keeps its own kind.</li>
     *   <li>other checked exceptions: {@code stageKind}.</li>
     *   <li>unchecked exceptions: {@link ErrorKind#UNEXPECTED}.</li>
     *   <li>{@link OutOfMemoryError}: {@link ErrorKind#RESOURCE}.</li>
     * </ul>
     * Messages name the operation and the key.
     */
    public static <T> Outcome<T> attempt(String operation, String key, ErrorKind stageKind, StageCall<T> call) {
        try {
            return ok(call.call());
        } catch (EpwBatchException e) {
            return err(e.getKind(), operation + " failed for " + key + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return err(stageKind, operation + " interrupted for " + key, e);
        } catch (RuntimeException e) {
            return err(ErrorKind.UNEXPECTED, "Unexpected error in " + operation + " for " + key + ": "
                    + e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        } catch (Exception e) {
            return err(stageKind, operation + " failed for " + key + ": " + e.getMessage(), e);
        } catch (OutOfMemoryError e) {
            return err(ErrorKind.RESOURCE, "Insufficient memory during " + operation + " for " + key, e);
        }
    }

    public boolean isOk() {
        return errorKind == null;
    }

    public T value() {
        if (!isOk()) {
            throw new IllegalStateException("No value on failed outcome: " + message);
        }
        return value;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }

    public String message() {
        return message;
    }

    public Throwable cause() {
        return cause;
    }

    public <U> Outcome<U> map(Function<? super T, ? extends U> fn) {
        return isOk() ? ok(fn.apply(value)) : propagate();
    }

    public <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> fn) {
        return isOk() ? fn.apply(value) : propagate();
    }

    /** Re-types a failed outcome. */
    @SuppressWarnings("unchecked")
    public <U> Outcome<U> propagate() {
        if (isOk()) {
            throw new IllegalStateException("Cannot propagate a successful outcome");
        }
        return (Outcome<U>) this;
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + value + ")" : "Err(" + errorKind + ", " + message + ")";
    }
}
