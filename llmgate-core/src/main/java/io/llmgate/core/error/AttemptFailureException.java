package io.llmgate.core.error;

import java.util.Objects;

/**
 * Failure of a single provider attempt. The gateway turns these into "try the next provider";
 * they never reach a caller directly.
 */
public abstract class AttemptFailureException extends GatewayException {
    private final String provider;

    protected AttemptFailureException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
    }

    public String provider() {
        return provider;
    }

    public abstract FailureKind kind();
}
