package io.llmgate.core.error;

/**
 * A route resolved to no usable provider, or configuration names a provider or purpose
 * that does not exist.
 */
public final class ConfigurationException extends GatewayException {

    public ConfigurationException(String message) {
        super(message);
    }
}
