package me.golemcore.tokens.adapter.outbound.provider;

import me.golemcore.tokens.domain.model.UsageRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class AmpUsageProviderTest {

    private static final String THREAD = """
            {
              "id": "T-1",
              "messages": [
                {"role": "user", "messageId": 0},
                {"role": "assistant", "messageId": 1,
                 "usage": {"cacheCreationInputTokens": 7, "cacheReadInputTokens": 9}}
              ],
              "usageLedger": {
                "events": [
                  {"id": "ev-1", "timestamp": "2026-03-01T10:00:00Z", "model": "claude-sonnet-4-5",
                   "tokens": {"input": 10, "output": 20}, "toMessageId": 1},
                  {"id": "ev-2", "timestamp": "2026-03-01T10:05:00Z", "tokens": {"input": 1, "output": 2}},
                  {"id": "ev-3", "tokens": {"input": 1}}
                ]
              }
            }
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

    private AmpUsageProvider provider(Map<String, String> env) {
        return new AmpUsageProvider(ProviderTestSupport.resolver(home, env), new FileDiscovery(),
                ProviderTestSupport.pipeline(executor), ProviderTestSupport.OBJECT_MAPPER);
    }

    @Test
    void joinsLedgerEventsWithMessageCacheTokens() throws IOException {
        Path dir = Files.createDirectories(home.resolve(".local/share/amp/threads"));
        Files.writeString(dir.resolve("T-1.json"), THREAD);

        List<UsageRecord> records = ProviderTestSupport.scan(provider(Map.of()), cacheDir);

        assertEquals(2, records.size());
        UsageRecord first = records.get(0);
        assertEquals("amp", first.getProvider());
        assertEquals("amp", first.getProject());
        assertEquals("T-1", first.getSessionId());
        assertEquals("ev-1", first.getMessageId());
        assertEquals(10, first.getInputTokens());
        assertEquals(20, first.getOutputTokens());
        assertEquals(7, first.getCacheCreationInputTokens());
        assertEquals(9, first.getCacheReadInputTokens());

        UsageRecord second = records.get(1);
        assertEquals("unknown", second.getModel());
        assertEquals(0, second.getCacheReadInputTokens());
    }

    @Test
    void ampDataDirOverridesXdgData() throws IOException {
        Path custom = home.resolve("amp-data");
        Files.createDirectories(custom.resolve("threads"));
        Files.writeString(custom.resolve("threads/T-1.json"), THREAD);

        AmpUsageProvider provider = provider(Map.of("AMP_DATA_DIR", custom.toString()));

        assertEquals(List.of(custom.resolve("threads")), provider.getRootDirectories());
        assertEquals(2, ProviderTestSupport.scan(provider, cacheDir).size());
    }

    @Test
    void malformedThreadYieldsNoRecords() throws IOException {
        Path dir = Files.createDirectories(home.resolve(".local/share/amp/threads"));
        Files.writeString(dir.resolve("broken.json"), "{\"id\": ");
        Files.writeString(dir.resolve("no-ledger.json"), "{\"id\": \"T-2\"}");

        assertTrue(ProviderTestSupport.scan(provider(Map.of()), cacheDir).isEmpty());
    }
}
