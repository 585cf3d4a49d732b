package me.golemcore.tokens.adapter.outbound.provider;

import me.golemcore.tokens.domain.model.UsageRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class CodexUsageProviderTest {

    private static final String LAST_USAGE_LOG = """
            {"timestamp":"2026-03-01T10:00:00Z","type":"turn_context","payload":{"model":"gpt-5-codex"}}
            {"timestamp":"2026-03-01T10:00:01Z","type":"event_msg","payload":{"type":"token_count","info":{"last_token_usage":{"input_tokens":100,"cached_input_tokens":40,"output_tokens":10}}}}
            {"timestamp":"2026-03-01T10:00:02Z","type":"event_msg","payload":{"type":"token_count","info":null}}
            {"timestamp":"2026-03-01T10:00:03Z","type":"event_msg","payload":{"type":"token_count","info":{"last_token_usage":{"input_tokens":0,"output_tokens":0}}}}
            """;

    private static final String TOTAL_USAGE_LOG = """
            {"timestamp":"2026-03-01T11:00:01Z","type":"event_msg","payload":{"type":"token_count","info":{"total_token_usage":{"input_tokens":100,"output_tokens":10,"cached_input_tokens":0}}}}
            {"timestamp":"2026-03-01T11:00:02Z","type":"event_msg","payload":{"type":"token_count","info":{"total_token_usage":{"input_tokens":250,"output_tokens":30,"cached_input_tokens":50}}}}
            {"timestamp":"2026-03-01T11:00:03Z","type":"event_msg","payload":{"type":"token_count","info":{"total_token_usage":{"input_tokens":250,"output_tokens":30,"cached_input_tokens":50}}}}
            """;

    @TempDir
    Path home;

    @TempDir
    Path cacheDir;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private CodexUsageProvider provider(Map<String, String> env) {
        return new CodexUsageProvider(ProviderTestSupport.resolver(home, env), new FileDiscovery(),
                ProviderTestSupport.pipeline(executor), ProviderTestSupport.OBJECT_MAPPER);
    }

    private static void write(Path sessions, String relative, String content) throws IOException {
        Path file = sessions.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void usesLastTokenUsageAndTurnContextModel() throws IOException {
        write(home.resolve(".codex/sessions"), "2026/03/01/rollout-abc.jsonl", LAST_USAGE_LOG);

        List<UsageRecord> records = ProviderTestSupport.scan(provider(Map.of()), cacheDir);

        assertEquals(1, records.size());
        UsageRecord record = records.get(0);
        assertEquals("codex", record.getProvider());
        assertEquals("gpt-5-codex", record.getModel());
        assertEquals("2026/03/01/rollout-abc", record.getSessionId());
        assertEquals("2026", record.getProject());
        assertEquals(100, record.getInputTokens());
        assertEquals(10, record.getOutputTokens());
        assertEquals(40, record.getCacheReadInputTokens());
        assertEquals("codex:2026/03/01/rollout-abc:2026-03-01T10:00:01Z:100:10", record.getMessageId());
        assertEquals("", record.getRequestId());
    }

    @Test
    void derivesDeltasFromCumulativeTotals() throws IOException {
        write(home.resolve(".codex/sessions"), "2026/03/01/rollout-def.jsonl", TOTAL_USAGE_LOG);

        List<UsageRecord> records = ProviderTestSupport.scan(provider(Map.of()), cacheDir).stream()
                .sorted(Comparator.comparing(UsageRecord::getTimestamp))
                .toList();

        assertEquals(2, records.size());
        assertEquals(100, records.get(0).getInputTokens());
        assertEquals(10, records.get(0).getOutputTokens());
        assertEquals(150, records.get(1).getInputTokens());
        assertEquals(20, records.get(1).getOutputTokens());
        assertEquals(50, records.get(1).getCacheReadInputTokens());
        assertEquals("gpt-5", records.get(1).getModel());
    }

    @Test
    void codexHomeOverridesDefaultLocations() throws IOException {
        Path custom = home.resolve("custom");
        write(custom.resolve("sessions"), "2026/03/01/rollout-abc.jsonl", LAST_USAGE_LOG);
        write(home.resolve(".codex/sessions"), "2026/03/01/rollout-zzz.jsonl", LAST_USAGE_LOG);

        CodexUsageProvider provider = provider(Map.of("CODEX_HOME", custom.toString()));

        assertEquals(List.of(custom.resolve("sessions")), provider.getRootDirectories());
        assertEquals(1, ProviderTestSupport.scan(provider, cacheDir).size());
    }

    @Test
    void sessionIdFallsBackToFileStem() {
        assertEquals("rollout-x", CodexUsageProvider.sessionIdFromPath(Path.of("/tmp/rollout-x.jsonl")));
        assertEquals("codex", CodexUsageProvider.projectFromSessionId(""));
    }
}
