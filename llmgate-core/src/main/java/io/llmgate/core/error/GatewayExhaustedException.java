package io.llmgate.core.error;

import java.util.List;
import java.util.Objects;

/**
 * Every provider in the resolved route failed. Carries the attempted providers in order and
 * the kind and message of the last failure.
 */
public final class GatewayExhaustedException extends GatewayException {
    private final List<String> attemptedProviders;
    private final FailureKind lastFailureKind;
    private final String lastFailureMessage;

    public GatewayExhaustedException(List<String> attemptedProviders, AttemptFailureException lastFailure) {
        super(describe(attemptedProviders, lastFailure), lastFailure);
        this.attemptedProviders = List.copyOf(attemptedProviders);
        this.lastFailureKind = Objects.requireNonNull(lastFailure, "lastFailure must not be null").kind();
        this.lastFailureMessage = lastFailure.getMessage() == null ? "" : lastFailure.getMessage();
    }

    public List<String> attemptedProviders() {
        return attemptedProviders;
    }

    public int attempts() {
        return attemptedProviders.size();
    }

    public FailureKind lastFailureKind() {
        return lastFailureKind;
    }

    public String lastFailureMessage() {
        return lastFailureMessage;
    }

    private static String describe(List<String> attempted, AttemptFailureException last) {
        return "All providers failed " + attempted + "; last failure "
            + (last == null ? "unknown" : last.kind().key() + ": " + last.getMessage());
    }
}
