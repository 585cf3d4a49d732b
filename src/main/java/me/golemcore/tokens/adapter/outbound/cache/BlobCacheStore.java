package me.golemcore.tokens.adapter.outbound.cache;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.google.protobuf.InvalidProtocolBufferException;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tokens.domain.exception.CacheStoreException;
import me.golemcore.tokens.domain.model.CachedFileEntry;
import me.golemcore.tokens.domain.model.FileFingerprint;
import me.golemcore.tokens.domain.model.UsageRecord;
import me.golemcore.tokens.port.outbound.CacheStorePort;
import me.golemcore.tokens.proto.cache.v1.ProviderCacheRecord;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cache store keeping one protobuf blob per provider,
 * {@code <cache-dir>/<provider>.pb}.
 *
 * <p>
 * A provider's blob is read whole the first time the provider is touched,
 * mutated in memory and written whole on {@link #flush()} when it changed.
 * Writes go to a temp file that is fsynced and then renamed over the blob, so
 * an interrupted run never leaves a partially written blob behind.
 *
 * <p>
 * A blob that cannot be parsed, or that was written with another format
 * version, is discarded and its provider's files are parsed again.
 *
 * @since 1.0
 */
@Slf4j
public class BlobCacheStore implements CacheStorePort {

    static final int FORMAT_VERSION = 1;
    static final String BLOB_EXTENSION = ".pb";
    private static final String LOG_PREFIX = "[Cache]";

    private final Path cacheDirectory;
    private final CacheRecordProtoMapper mapper = new CacheRecordProtoMapper();
    private final Map<String, Partition> partitions = new LinkedHashMap<>();

    public BlobCacheStore(Path cacheDirectory) {
        this.cacheDirectory = cacheDirectory;
        try {
            Files.createDirectories(cacheDirectory);
        } catch (IOException e) {
            throw new CacheStoreException("Cannot create cache directory " + cacheDirectory, e);
        }
    }

    @Override
    public String getBackendName() {
        return "blob";
    }

    @Override
    public boolean isCached(String provider, String path, FileFingerprint fingerprint) {
        CachedFileEntry entry = partition(provider).entries.get(path);
        return entry != null && entry.fingerprint().equals(fingerprint);
    }

    @Override
    public void insert(String provider, String path, FileFingerprint fingerprint, List<UsageRecord> records) {
        Partition partition = partition(provider);
        partition.entries.put(path, new CachedFileEntry(fingerprint, records));
        partition.dirty = true;
    }

    @Override
    public void prune(String provider, Collection<String> knownPaths) {
        Set<String> known = new HashSet<>(knownPaths);
        Partition partition = partition(provider);
        if (partition.entries.keySet().removeIf(path -> !known.contains(path))) {
            partition.dirty = true;
        }
    }

    @Override
    public void flush() {
        for (Map.Entry<String, Partition> entry : partitions.entrySet()) {
            Partition partition = entry.getValue();
            if (!partition.dirty) {
                continue;
            }
            String provider = entry.getKey();
            byte[] bytes = mapper.toProto(provider, FORMAT_VERSION, partition.entries).toByteArray();
            try {
                writeAtomic(blobPath(provider), bytes);
                partition.dirty = false;
                log.debug("{} Wrote {} ({} files, {} bytes)", LOG_PREFIX, provider, partition.entries.size(),
                        bytes.length);
            } catch (IOException e) {
                log.warn("{} Failed to write cache for {}: {}", LOG_PREFIX, provider, e.getMessage());
            }
        }
    }

    /**
     * Returns the records of every loaded partition plus every blob on disk
     * that was not touched this run, then releases the in-memory copies.
     */
    @Override
    public List<UsageRecord> drainAll() {
        loadUntouchedBlobs();
        List<UsageRecord> records = new ArrayList<>();
        for (Partition partition : partitions.values()) {
            for (CachedFileEntry entry : partition.entries.values()) {
                records.addAll(entry.records());
            }
        }
        partitions.clear();
        return records;
    }

    private void loadUntouchedBlobs() {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(cacheDirectory, "*" + BLOB_EXTENSION)) {
            List<String> providers = new ArrayList<>();
            for (Path blob : stream) {
                String fileName = blob.getFileName().toString();
                providers.add(fileName.substring(0, fileName.length() - BLOB_EXTENSION.length()));
            }
            providers.sort(null);
            providers.forEach(this::partition);
        } catch (IOException e) {
            log.warn("{} Failed to list {}: {}", LOG_PREFIX, cacheDirectory, e.getMessage());
        }
    }

    private Partition partition(String provider) {
        return partitions.computeIfAbsent(provider, this::load);
    }

    private Partition load(String provider) {
        Path blob = blobPath(provider);
        if (!Files.exists(blob)) {
            return new Partition(new LinkedHashMap<>(), false);
        }
        try {
            ProviderCacheRecord record = ProviderCacheRecord.parseFrom(Files.readAllBytes(blob));
            if (record.getFormatVersion() != FORMAT_VERSION) {
                log.warn("{} Discarding {} cache: format version {} (expected {})", LOG_PREFIX, provider,
                        record.getFormatVersion(), FORMAT_VERSION);
                return new Partition(new LinkedHashMap<>(), true);
            }
            Map<String, CachedFileEntry> entries = mapper.fromProto(provider, record);
            log.debug("{} Loaded {} cache: {} files", LOG_PREFIX, provider, entries.size());
            return new Partition(entries, false);
        } catch (InvalidProtocolBufferException e) {
            log.warn("{} Discarding unreadable {} cache: {}", LOG_PREFIX, provider, e.getMessage());
            return new Partition(new LinkedHashMap<>(), true);
        } catch (IOException e) {
            log.warn("{} Failed to read {} cache: {}", LOG_PREFIX, provider, e.getMessage());
            return new Partition(new LinkedHashMap<>(), true);
        }
    }

    private Path blobPath(String provider) {
        return cacheDirectory.resolve(provider + BLOB_EXTENSION);
    }

    private void writeAtomic(Path target, byte[] bytes) throws IOException {
        Path tempPath = target.resolveSibling(target.getFileName() + ".tmp");

        try {
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }

            try {
                Files.move(tempPath, target,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("{} Atomic move not supported, using regular move", LOG_PREFIX);
                Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("{} Failed to cleanup temp file: {}", LOG_PREFIX, tempPath);
            }
            throw e;
        }
    }

    private static final class Partition {
        private final Map<String, CachedFileEntry> entries;
        private boolean dirty;

        private Partition(Map<String, CachedFileEntry> entries, boolean dirty) {
            this.entries = entries;
            this.dirty = dirty;
        }
    }
}
