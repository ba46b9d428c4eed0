package io.llmgate.core.error;

import java.util.OptionalInt;

/**
 * Transport, authentication or non-2xx failure reported by a provider.
 */
public final class ProviderInvocationException extends AttemptFailureException {
    private final int statusCode;

    public ProviderInvocationException(String provider, String message) {
        this(provider, message, -1, null);
    }

    public ProviderInvocationException(String provider, String message, Throwable cause) {
        this(provider, message, -1, cause);
    }

    public ProviderInvocationException(String provider, String message, int statusCode, Throwable cause) {
        super(provider, message, cause);
        this.statusCode = statusCode;
    }

    public OptionalInt statusCode() {
        return statusCode < 0 ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.INVOCATION;
    }
}
