package io.llmgate.core.error;

public final class ProviderTimeoutException extends AttemptFailureException {
    private final long timeoutMs;

    public ProviderTimeoutException(String provider, long timeoutMs) {
        super(provider, "provider " + provider + " did not respond within " + timeoutMs + " ms", null);
        this.timeoutMs = timeoutMs;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.TIMEOUT;
    }
}
