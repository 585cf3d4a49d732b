package me.golemcore.tokens.testsupport;

import me.golemcore.tokens.domain.model.UsageRecord;

import java.time.Instant;

/**
 * Record fixtures shared by tests.
 */
public final class UsageRecords {

    private UsageRecords() {
    }

    public static UsageRecord record(String provider, String messageId, String model, long input, long output) {
        return UsageRecord.builder()
                .provider(provider)
                .sessionId("session-1")
                .timestamp(Instant.parse("2026-03-01T10:00:00Z"))
                .project("demo")
                .model(model)
                .messageId(messageId)
                .requestId("req-" + messageId)
                .inputTokens(input)
                .outputTokens(output)
                .build();
    }

    public static UsageRecord record(String model, long input, long output) {
        return record("claude", "msg-" + model + "-" + input + "-" + output, model, input, output);
    }
}
