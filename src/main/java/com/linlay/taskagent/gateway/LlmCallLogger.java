package com.linlay.taskagent.gateway;

import com.linlay.taskagent.config.LlmInteractionLogProperties;
import org.slf4j.Logger;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Trace ids and switchable, masked logging around model calls.
 */
class LlmCallLogger {

    private final boolean enabled;
    private final boolean maskSensitive;

    LlmCallLogger(LlmInteractionLogProperties properties) {
        this.enabled = properties == null || properties.isEnabled();
        this.maskSensitive = properties == null || properties.isMaskSensitive();
    }

    String generateTraceId() {
        return "llm-" + UUID.randomUUID().toString().replace("-", "");
    }

    long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    String sanitizeText(String text) {
        return LlmLogSanitizer.maskText(text, maskSensitive);
    }

    void info(Logger logger, String pattern, Object... arguments) {
        if (enabled) {
            logger.info(pattern, arguments);
        }
    }

    void logTranscript(Logger logger, String traceId, Transcript transcript) {
        if (!enabled || !logger.isDebugEnabled()) {
            return;
        }
        StringBuilder builder = new StringBuilder();
        List<TranscriptEntry> entries = transcript.entries();
        for (int i = 0; i < entries.size(); i++) {
            TranscriptEntry entry = entries.get(i);
            builder.append('[').append(i).append("] role=")
                    .append(entry.role().name().toLowerCase(Locale.ROOT))
                    .append(", text=")
                    .append(sanitizeText(entry.content()));
            if (entry.hasToolCalls()) {
                builder.append(", toolCalls=").append(entry.toolCalls().size());
            }
            if (entry.callId() != null) {
                builder.append(", callId=").append(entry.callId());
            }
            builder.append('\n');
        }
        logger.debug("[{}] LLM transcript:\n{}", traceId, builder);
    }
}
