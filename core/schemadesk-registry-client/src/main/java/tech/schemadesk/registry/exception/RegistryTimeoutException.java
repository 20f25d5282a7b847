package tech.schemadesk.registry.exception;

import java.time.Duration;

/**
 * Exception thrown when a registry call exceeds the configured timeout.
 */
public class RegistryTimeoutException extends SchemaRegistryException {

    private final Duration timeout;

    public RegistryTimeoutException(String message, Duration timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }

    public static RegistryTimeoutException after(Duration timeout, String method, String path, Throwable cause) {
        return new RegistryTimeoutException(
            "Connection timeout (>" + timeout.toSeconds() + "s) on " + method + " " + path,
            timeout, cause
        );
    }

    public Duration getTimeout() {
        return timeout;
    }
}
