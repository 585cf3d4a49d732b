package me.golemcore.tokens.adapter.outbound.provider;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.tokens.adapter.outbound.provider.ProviderRootResolver.DefaultRoot;
import me.golemcore.tokens.domain.model.UsageRecord;
import me.golemcore.tokens.domain.service.ParallelParsePipeline;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Amp thread files: {@code $XDG_DATA_HOME/amp/threads/*.json}.
 *
 * <p>
 * Billable usage is read from {@code usageLedger.events}. Cache token counts
 * live on the assistant message the event points to through
 * {@code toMessageId}.
 */
@Component
@Order(4)
public class AmpUsageProvider extends AbstractFileUsageProvider {

    static final String NAME = "amp";

    public AmpUsageProvider(ProviderRootResolver rootResolver, FileDiscovery fileDiscovery,
            ParallelParsePipeline pipeline, ObjectMapper objectMapper) {
        super(NAME, "json", rootResolver, fileDiscovery, pipeline, objectMapper);
    }

    @Override
    protected List<Path> resolveRoots(ProviderRootResolver resolver) {
        return resolver.resolve("AMP_DATA_DIR", "threads", List.of(DefaultRoot.data("amp/threads")));
    }

    @Override
    protected List<UsageRecord> parseFile(Path file) throws IOException {
        JsonNode thread = readTree(file);
        JsonNode events = thread.path("usageLedger").path("events");
        if (!events.isArray()) {
            return List.of();
        }
        String threadId = textOrDefault(thread, "id", "unknown");
        Map<Long, CacheTokens> cacheTokens = cacheTokensByMessage(thread.path("messages"));

        List<UsageRecord> records = new ArrayList<>();
        for (JsonNode event : events) {
            Instant timestamp = parseTimestamp(text(event, "timestamp"));
            JsonNode tokens = event.path("tokens");
            if (timestamp == null || !tokens.isObject()) {
                continue;
            }
            JsonNode toMessageId = event.path("toMessageId");
            CacheTokens cache = isCount(toMessageId)
                    ? cacheTokens.getOrDefault(toMessageId.asLong(), CacheTokens.NONE)
                    : CacheTokens.NONE;

            records.add(UsageRecord.builder()
                    .provider(NAME)
                    .sessionId(threadId)
                    .timestamp(timestamp)
                    .project(NAME)
                    .model(textOrDefault(event, "model", "unknown"))
                    .messageId(textOrDefault(event, "id", ""))
                    .inputTokens(count(tokens, "input"))
                    .outputTokens(count(tokens, "output"))
                    .cacheCreationInputTokens(cache.creation())
                    .cacheReadInputTokens(cache.read())
                    .build());
        }
        return records;
    }

    private static Map<Long, CacheTokens> cacheTokensByMessage(JsonNode messages) {
        Map<Long, CacheTokens> map = new HashMap<>();
        if (!messages.isArray()) {
            return map;
        }
        for (JsonNode message : messages) {
            JsonNode messageId = message.path("messageId");
            JsonNode usage = message.path("usage");
            if (!"assistant".equals(text(message, "role")) || !isCount(messageId) || !usage.isObject()) {
                continue;
            }
            map.put(messageId.asLong(), new CacheTokens(
                    count(usage, "cacheCreationInputTokens"),
                    count(usage, "cacheReadInputTokens")));
        }
        return map;
    }

    private record CacheTokens(long creation, long read) {
        private static final CacheTokens NONE = new CacheTokens(0, 0);
    }
}
