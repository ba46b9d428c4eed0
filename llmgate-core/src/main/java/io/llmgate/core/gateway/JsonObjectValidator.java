package io.llmgate.core.gateway;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmgate.core.error.InvalidJsonOutputException;
import java.util.Locale;

/**
 * Accepts content only when the whole text is a single JSON object. Failure messages name the
 * position or node type, never the generated text itself.
 */
final class JsonObjectValidator {
    private final ObjectMapper mapper;

    JsonObjectValidator() {
        mapper = new ObjectMapper();
        mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    void requireObject(String provider, String content) {
        JsonNode node;
        try {
            node = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            // The parser's own message quotes the offending token.
            throw new InvalidJsonOutputException(
                provider,
                "provider " + provider + " returned malformed JSON" + position(e.getLocation())
                    + " (" + content.length() + " chars)",
                null
            );
        }
        if (node == null || !node.isObject()) {
            String actual = node == null || node.isMissingNode()
                ? "empty content"
                : node.getNodeType().name().toLowerCase(Locale.ROOT);
            throw new InvalidJsonOutputException(
                provider,
                "provider " + provider + " returned " + actual + " where a JSON object is required",
                null
            );
        }
    }

    private static String position(JsonLocation location) {
        if (location == null) {
            return "";
        }
        return " at line " + location.getLineNr() + " column " + location.getColumnNr();
    }
}
