package dev.epwbatch.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Root of all classified failures. Carries an {@link ErrorKind} and a small context map
 * (station id, year, path, ...) that is rendered into {@link #describe()} for logs and results.
 */
public class EpwBatchException extends RuntimeException {
    private final ErrorKind kind;
    private final Map<String, Object> context;

    public EpwBatchException(ErrorKind kind, String message) {
        this(kind, message, Map.of(), null);
    }

    public EpwBatchException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, Map.of(), cause);
    }

    public EpwBatchException(ErrorKind kind, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        Map<String, Object> copy = new LinkedHashMap<>();
        if (context != null) {
            context.forEach((k, v) -> {
                if (v != null) copy.put(k, v);
            });
        }
        this.context = Collections.unmodifiableMap(copy);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getErrorCode() {
        return kind.code();
    }

    public Map<String, Object> getContext() {
        return context;
    }

    /**
     * Renders {@code [CODE] message | Context: k=v, ...}.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder("[").append(kind.code()).append("] ").append(getMessage());
        if (!context.isEmpty()) {
            sb.append(" | Context: ").append(context.entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining(", ")));
        }
        return sb.toString();
    }

    static Map<String, Object> context(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return map;
    }
}
