package me.golemcore.tokens.adapter.outbound.cache;

import me.golemcore.tokens.domain.exception.CacheStoreException;
import me.golemcore.tokens.port.outbound.CacheStorePort;
import me.golemcore.tokens.proto.cache.v1.ProviderCacheRecord;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static me.golemcore.tokens.testsupport.UsageRecords.record;
import static org.junit.jupiter.api.Assertions.*;

class BlobCacheStoreTest extends AbstractCacheStoreContractTest {

    @Override
    protected CacheStorePort open(Path directory) {
        return new BlobCacheStore(directory);
    }

    @Test
    void writesOneBlobPerProviderOnFlush() {
        store.insert("claude", "/a.jsonl", FP, List.of(record("claude", "a", "x", 1, 1)));
        store.insert("codex", "/b.jsonl", FP, List.of());

        assertFalse(Files.exists(cacheDir.resolve("claude.pb")));
        store.flush();

        assertTrue(Files.exists(cacheDir.resolve("claude.pb")));
        assertTrue(Files.exists(cacheDir.resolve("codex.pb")));
        assertFalse(Files.exists(cacheDir.resolve("claude.pb.tmp")));
    }

    @Test
    void untouchedProviderIsNotRewritten() throws IOException {
        store.insert("claude", "/a.jsonl", FP, List.of(record("claude", "a", "x", 1, 1)));
        store.flush();
        Path blob = cacheDir.resolve("claude.pb");
        Files.setLastModifiedTime(blob, FileTime.fromMillis(0));

        CacheStorePort reopened = reopen();
        assertTrue(reopened.isCached("claude", "/a.jsonl", FP));
        reopened.flush();

        assertEquals(0, Files.getLastModifiedTime(blob).toMillis());
    }

    @Test
    void corruptBlobIsDiscardedAndRebuilt() throws IOException {
        Files.write(cacheDir.resolve("claude.pb"), new byte[] { (byte) 0xff, 0x01, 0x02, 0x03 });

        CacheStorePort reopened = reopen();

        assertFalse(reopened.isCached("claude", "/a.jsonl", FP));
        reopened.insert("claude", "/a.jsonl", FP, List.of(record("claude", "a", "x", 1, 1)));
        reopened.flush();
        assertTrue(reopen().isCached("claude", "/a.jsonl", FP));
    }

    @Test
    void blobWithOtherFormatVersionIsDiscarded() throws IOException {
        store.insert("claude", "/a.jsonl", FP, List.of(record("claude", "a", "x", 1, 1)));
        store.flush();
        Path blob = cacheDir.resolve("claude.pb");
        ProviderCacheRecord stale = ProviderCacheRecord.parseFrom(Files.readAllBytes(blob)).toBuilder()
                .setFormatVersion(BlobCacheStore.FORMAT_VERSION + 1)
                .build();
        Files.write(blob, stale.toByteArray());

        CacheStorePort reopened = reopen();

        assertFalse(reopened.isCached("claude", "/a.jsonl", FP));
        reopened.flush();
        assertEquals(BlobCacheStore.FORMAT_VERSION,
                ProviderCacheRecord.parseFrom(Files.readAllBytes(blob)).getFormatVersion());
    }

    @Test
    void drainIncludesBlobsOfProvidersNotTouchedThisRun() {
        store.insert("gemini", "/g.json", FP, List.of(record("gemini", "g", "x", 1, 1)));
        store.flush();

        assertEquals(1, reopen().drainAll().size());
    }

    @Test
    void drainReleasesMemoryButKeepsBlobs() {
        store.insert("claude", "/a.jsonl", FP, List.of(record("claude", "a", "x", 1, 1)));
        store.flush();

        assertEquals(1, store.drainAll().size());
        assertTrue(store.isCached("claude", "/a.jsonl", FP));
    }

    @Test
    void failedWriteRemovesTempFile() throws IOException {
        Path blocked = Files.createDirectories(cacheDir.resolve("claude.pb"));
        Files.createFile(blocked.resolve("keep"));

        CacheStorePort reopened = reopen();
        reopened.insert("claude", "/a.jsonl", FP, List.of(record("claude", "a", "x", 1, 1)));
        reopened.flush();

        assertTrue(Files.isDirectory(blocked));
        assertFalse(Files.exists(cacheDir.resolve("claude.pb.tmp")));
    }

    @Test
    void failsWhenCacheDirectoryCannotBeCreated() throws IOException {
        Path file = Files.createFile(cacheDir.resolve("not-a-dir"));

        assertThrows(CacheStoreException.class, () -> new BlobCacheStore(file.resolve("cache")));
    }
}
