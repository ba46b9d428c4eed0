package io.llmgate.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.llmgate.core.config.model.GatewayConfig;
import io.llmgate.core.config.model.ProviderConfig;
import io.llmgate.core.config.model.RoutingConfig;
import io.llmgate.core.error.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the gateway configuration once at startup: file values deep-merged over built-in
 * defaults, then environment overrides on top.
 */
public final class ConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigService.class);

    static final String LLM_PROVIDER = "LLM_PROVIDER";
    static final String DEEPSEEK_API_KEY = "DEEPSEEK_API_KEY";
    static final String OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String LOCAL_ENABLED = "LLM_LOCAL_ENABLED";
    static final String LOCAL_BASE_URL = "LLM_LOCAL_BASE_URL";
    static final String LOCAL_MODEL = "LLM_LOCAL_MODEL";
    static final String LOCAL_API_KEY = "LLM_LOCAL_API_KEY";
    static final String LOCAL_TIMEOUT_MS = "LLM_LOCAL_TIMEOUT_MS";
    static final String LOCAL_PURPOSES = "LLM_LOCAL_PURPOSES";
    static final String CLOUD_TIMEOUT_MS_FIELDS_ONLY = "LLM_CLOUD_TIMEOUT_MS_FIELDS_ONLY";

    private static final String LOCAL = "local";
    private static final String FIELDS_ONLY_PURPOSE = "propose_fields_only";

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
    }

    public GatewayConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return GatewayConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(GatewayConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        try {
            return mapper.treeToValue(merged, GatewayConfig.class);
        } catch (JsonMappingException e) {
            // Record constructors reject invalid values; surface that rather than Jackson's wrapper.
            for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
                if (cause instanceof ConfigurationException invalid) {
                    throw invalid;
                }
            }
            throw e;
        }
    }

    public GatewayConfig load(Path configPath, Map<String, String> environment) throws IOException {
        return applyEnvironment(load(configPath), environment);
    }

    public void save(Path configPath, GatewayConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        GatewayConfig config;
        if (created || overwrite) {
            config = GatewayConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);
        return new InitResult(configPath, created, overwritten);
    }

    public String toPrettyJson(GatewayConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    /**
     * Overlays the deployment environment variables. Purposes listed in
     * {@code LLM_LOCAL_PURPOSES} are routed to the local provider first, then the primary.
     */
    public GatewayConfig applyEnvironment(GatewayConfig config, Map<String, String> environment) {
        if (environment == null || environment.isEmpty()) {
            return config;
        }
        GatewayConfig result = config;
        RoutingConfig routing = result.routing();

        String primary = value(environment, LLM_PROVIDER);
        if (primary != null) {
            routing = routing.withPrimary(primary.toLowerCase(Locale.ROOT));
        }

        result = withCredential(result, "deepseek", value(environment, DEEPSEEK_API_KEY));
        result = withCredential(result, "openai", value(environment, OPENAI_API_KEY));

        ProviderConfig local = result.providers().getOrDefault(LOCAL, ProviderConfig.of("", "", false));
        boolean localTouched = false;
        String enabled = value(environment, LOCAL_ENABLED);
        if (enabled != null) {
            local = local.withEnabled(parseBoolean(enabled));
            localTouched = true;
        }
        String baseUrl = value(environment, LOCAL_BASE_URL);
        if (baseUrl != null) {
            local = local.withApiBase(baseUrl);
            localTouched = true;
        }
        String model = value(environment, LOCAL_MODEL);
        if (model != null) {
            local = local.withModel(model);
            localTouched = true;
        }
        String localKey = value(environment, LOCAL_API_KEY);
        if (localKey != null) {
            local = local.withApiKey(localKey);
            localTouched = true;
        }
        Long localTimeout = parseLong(environment, LOCAL_TIMEOUT_MS);
        if (localTimeout != null) {
            local = local.withTimeoutMs(localTimeout);
            localTouched = true;
        }
        if (localTouched) {
            result = result.withProvider(LOCAL, local);
        }

        String purposes = value(environment, LOCAL_PURPOSES);
        if (purposes != null) {
            for (String purpose : splitList(purposes)) {
                routing = routing.withRoute(purpose, List.of(LOCAL, routing.primary()));
            }
        }

        Long fieldsOnlyTimeout = parseLong(environment, CLOUD_TIMEOUT_MS_FIELDS_ONLY);
        if (fieldsOnlyTimeout != null) {
            routing = routing.withPurposeTimeout(FIELDS_ONLY_PURPOSE, fieldsOnlyTimeout);
        }

        return result.withRouting(routing);
    }

    private GatewayConfig withCredential(GatewayConfig config, String provider, String apiKey) {
        if (apiKey == null) {
            return config;
        }
        ProviderConfig existing = config.providers().get(provider);
        if (existing == null) {
            LOG.debug("Ignoring credential for unconfigured provider {}", provider);
            return config;
        }
        return config.withProvider(provider, existing.withApiKey(apiKey));
    }

    private String value(Map<String, String> environment, String key) {
        String raw = environment.get(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.trim();
    }

    private Long parseLong(Map<String, String> environment, String key) {
        String raw = value(environment, key);
        if (raw == null) {
            return null;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a whole number of milliseconds: " + raw, e);
        }
    }

    private boolean parseBoolean(String raw) {
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized) || "on".equals(normalized);
    }

    private List<String> splitList(String raw) {
        List<String> items = new ArrayList<>();
        for (String item : raw.split(",")) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
