package me.golemcore.tokens.adapter.outbound.provider;

import me.golemcore.tokens.domain.model.UsageRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class PiUsageProviderTest {

    private static final String SESSION_LOG = """
            {"type":"session","id":"abc123","timestamp":"2026-03-01T09:59:00Z"}
            {"type":"message","timestamp":"2026-03-01T10:00:00Z","message":{"role":"assistant","model":"claude-sonnet-4-5","usage":{"input":10,"output":5,"cacheRead":3,"cacheWrite":2}}}
            {"type":"message","timestamp":"2026-03-01T10:00:01Z","message":{"role":"assistant","usage":{"input":1}}}
            {"type":"message","timestamp":"2026-03-01T10:00:02Z","message":{"role":"user","content":"assistant"}}
            {"type":"message","timestamp":"2026-03-01T10:00:03Z","message":{"role":"assistant","usage":{"input":7,"output":8}}}
            """;

    @TempDir
    Path home;

    @TempDir
    Path cacheDir;

    private ExecutorService executor;
    private PiUsageProvider provider;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        provider = new PiUsageProvider(ProviderTestSupport.resolver(home, Map.of()), new FileDiscovery(),
                ProviderTestSupport.pipeline(executor), ProviderTestSupport.OBJECT_MAPPER);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void parsesAssistantMessagesWithUsage() throws IOException {
        Path dir = Files.createDirectories(home.resolve(".pi/agent/sessions/--home-alice-proj--"));
        Files.writeString(dir.resolve("2026-03-01T10-00-00-000Z_abc123.jsonl"), SESSION_LOG);

        List<UsageRecord> records = ProviderTestSupport.scan(provider, cacheDir);

        assertEquals(2, records.size());
        UsageRecord first = records.get(0);
        assertEquals("pi", first.getProvider());
        assertEquals("abc123", first.getSessionId());
        assertEquals("--home-alice-proj--", first.getProject());
        assertEquals("claude-sonnet-4-5", first.getModel());
        assertEquals(Instant.parse("2026-03-01T10:00:00Z"), first.getTimestamp());
        assertEquals(2, first.getCacheCreationInputTokens());
        assertEquals(3, first.getCacheReadInputTokens());
        assertEquals("pi:abc123:2026-03-01T10:00:00Z:10:5", first.getMessageId());
        assertEquals("unknown", records.get(1).getModel());
    }

    @Test
    void derivesSessionAndProjectFromPath() {
        assertEquals("plain", PiUsageProvider.sessionIdFromPath(Path.of("/x/plain.jsonl")));
        assertEquals("trailing_", PiUsageProvider.sessionIdFromPath(Path.of("/x/trailing_.jsonl")));
        assertEquals("pi", PiUsageProvider.projectFromPath(Path.of("/x/sessions/file.jsonl")));
    }
}
