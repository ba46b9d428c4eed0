package io.llmgate.core.error;

public enum FailureKind {
    TIMEOUT("timeout"),
    INVOCATION("invocation"),
    INVALID_JSON("invalid_json");

    private final String key;

    FailureKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
