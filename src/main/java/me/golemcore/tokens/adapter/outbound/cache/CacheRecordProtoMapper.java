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

import com.google.protobuf.Timestamp;
import me.golemcore.tokens.domain.model.CachedFileEntry;
import me.golemcore.tokens.domain.model.FileFingerprint;
import me.golemcore.tokens.domain.model.UsageRecord;
import me.golemcore.tokens.proto.cache.v1.CachedFileRecord;
import me.golemcore.tokens.proto.cache.v1.ProviderCacheRecord;
import me.golemcore.tokens.proto.cache.v1.UsageEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a provider's cached file entries to/from protobuf records.
 */
public class CacheRecordProtoMapper {

    public ProviderCacheRecord toProto(String provider, int formatVersion, Map<String, CachedFileEntry> entries) {
        ProviderCacheRecord.Builder builder = ProviderCacheRecord.newBuilder()
                .setFormatVersion(formatVersion)
                .setProvider(provider);
        for (Map.Entry<String, CachedFileEntry> entry : entries.entrySet()) {
            CachedFileEntry cached = entry.getValue();
            CachedFileRecord.Builder file = CachedFileRecord.newBuilder()
                    .setPath(entry.getKey())
                    .setMtimeSecs(cached.fingerprint().mtimeSeconds())
                    .setSize(cached.fingerprint().sizeBytes());
            for (UsageRecord record : cached.records()) {
                file.addRecords(toProtoEntry(record));
            }
            builder.addFiles(file.build());
        }
        return builder.build();
    }

    /**
     * @return entries in stored order, records carrying {@code provider}
     */
    public Map<String, CachedFileEntry> fromProto(String provider, ProviderCacheRecord record) {
        Map<String, CachedFileEntry> entries = new LinkedHashMap<>();
        for (CachedFileRecord file : record.getFilesList()) {
            List<UsageRecord> records = new ArrayList<>(file.getRecordsCount());
            for (UsageEntry entry : file.getRecordsList()) {
                records.add(fromProtoEntry(provider, entry));
            }
            entries.put(file.getPath(),
                    new CachedFileEntry(new FileFingerprint(file.getMtimeSecs(), file.getSize()), records));
        }
        return entries;
    }

    private UsageEntry toProtoEntry(UsageRecord record) {
        UsageEntry.Builder builder = UsageEntry.newBuilder()
                .setInputTokens(record.getInputTokens())
                .setOutputTokens(record.getOutputTokens())
                .setCacheCreationInputTokens(record.getCacheCreationInputTokens())
                .setCacheReadInputTokens(record.getCacheReadInputTokens());
        putIfNotEmpty(record.getSessionId(), builder::setSessionId);
        putIfNotEmpty(record.getProject(), builder::setProject);
        putIfNotEmpty(record.getModel(), builder::setModel);
        putIfNotEmpty(record.getMessageId(), builder::setMessageId);
        putIfNotEmpty(record.getRequestId(), builder::setRequestId);
        if (record.getTimestamp() != null) {
            builder.setTimestamp(toTimestamp(record.getTimestamp()));
        }
        return builder.build();
    }

    private UsageRecord fromProtoEntry(String provider, UsageEntry entry) {
        return UsageRecord.builder()
                .provider(provider)
                .sessionId(entry.getSessionId())
                .timestamp(fromTimestamp(entry.getTimestamp()))
                .project(entry.getProject())
                .model(entry.getModel())
                .messageId(entry.getMessageId())
                .requestId(entry.getRequestId())
                .inputTokens(entry.getInputTokens())
                .outputTokens(entry.getOutputTokens())
                .cacheCreationInputTokens(entry.getCacheCreationInputTokens())
                .cacheReadInputTokens(entry.getCacheReadInputTokens())
                .build();
    }

    private Timestamp toTimestamp(Instant instant) {
        return Timestamp.newBuilder()
                .setSeconds(instant.getEpochSecond())
                .setNanos(instant.getNano())
                .build();
    }

    private Instant fromTimestamp(Timestamp timestamp) {
        return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    }

    private void putIfNotEmpty(String value, java.util.function.Consumer<String> setter) {
        if (value != null && !value.isEmpty()) {
            setter.accept(value);
        }
    }
}
