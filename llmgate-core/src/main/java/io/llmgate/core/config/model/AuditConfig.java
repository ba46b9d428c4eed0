package io.llmgate.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditConfig(Boolean enabled, String path) {

    public static AuditConfig defaults() {
        return new AuditConfig(true, "~/.llmgate/audit-events.json");
    }

    public boolean active() {
        return Boolean.TRUE.equals(enabled) && path != null && !path.isBlank();
    }
}
