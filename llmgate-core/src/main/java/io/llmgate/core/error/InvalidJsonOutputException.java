package io.llmgate.core.error;

public final class InvalidJsonOutputException extends AttemptFailureException {

    public InvalidJsonOutputException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.INVALID_JSON;
    }
}
