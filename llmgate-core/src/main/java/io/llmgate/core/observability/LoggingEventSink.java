package io.llmgate.core.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingEventSink implements GenerationEventSink {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingEventSink.class);

    @Override
    public void emit(GenerationEvent event) {
        if (event.outcome() == GenerationEvent.Outcome.SUCCEEDED) {
            LOG.info(
                "LLM done purpose={} provider={} model={} json_mode={} sys_chars={} user_chars={} ms={} attempts={} fallback={}",
                event.purpose().key(),
                event.provider(),
                event.model(),
                event.jsonMode(),
                event.systemPromptChars(),
                event.userPromptChars(),
                event.latencyMs(),
                event.attempts(),
                event.usedFallback()
            );
            return;
        }
        LOG.warn(
            "LLM exhausted purpose={} providers={} failure={} json_mode={} sys_chars={} user_chars={} ms={} attempts={}",
            event.purpose().key(),
            event.attemptedProviders(),
            event.failureKind() == null ? "" : event.failureKind().key(),
            event.jsonMode(),
            event.systemPromptChars(),
            event.userPromptChars(),
            event.latencyMs(),
            event.attempts()
        );
    }
}
