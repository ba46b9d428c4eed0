package io.llmgate.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Calling use-case of a generation request. Drives route selection and shows up in logs,
 * never in the prompt sent to a provider.
 */
public enum Purpose {
    GENERATE("generate"),
    ANALYZE_TICKET("analyze_ticket"),
    ANALYZE_TICKET_COT("analyze_ticket_cot"),
    PROPOSE_FIELDS_ONLY("propose_fields_only"),
    PROPOSE_SOLUTION("propose_solution");

    private final String key;

    Purpose(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Strict lookup, used when binding route tables so a misspelled purpose fails at startup.
     */
    public static Optional<Purpose> fromKey(String raw) {
        String normalized = normalize(raw);
        for (Purpose purpose : values()) {
            if (purpose.key.equals(normalized)) {
                return Optional.of(purpose);
            }
        }
        return Optional.empty();
    }

    /**
     * Lenient lookup for free-form caller input. Unknown keys map to {@link #GENERATE}, which has
     * no route entry of its own and therefore uses the default route.
     */
    public static Purpose parse(String raw) {
        return fromKey(raw).orElse(GENERATE);
    }

    private static String normalize(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
