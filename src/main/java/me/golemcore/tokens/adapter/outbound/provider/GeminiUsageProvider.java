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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.tokens.adapter.outbound.provider.ProviderRootResolver.DefaultRoot;
import me.golemcore.tokens.domain.model.UsageRecord;
import me.golemcore.tokens.domain.service.ParallelParsePipeline;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Gemini CLI chat checkpoints: {@code ~/.gemini/tmp/<project-hash>/chats/*.json}.
 *
 * <p>
 * Only {@code gemini} messages with a model and non-zero input or output are
 * counted. A message without a usable timestamp is dated by the file's
 * modification time.
 */
@Component
@Order(6)
public class GeminiUsageProvider extends AbstractFileUsageProvider {

    static final String NAME = "gemini";

    private final Clock clock;

    public GeminiUsageProvider(ProviderRootResolver rootResolver, FileDiscovery fileDiscovery,
            ParallelParsePipeline pipeline, ObjectMapper objectMapper, Clock clock) {
        super(NAME, "json", rootResolver, fileDiscovery, pipeline, objectMapper);
        this.clock = clock;
    }

    @Override
    protected List<Path> resolveRoots(ProviderRootResolver resolver) {
        return resolver.resolve("GEMINI_HOME", "tmp", List.of(DefaultRoot.home(".gemini/tmp")));
    }

    @Override
    protected List<UsageRecord> parseFile(Path file) throws IOException {
        GeminiSession session = objectMapper.readValue(file.toFile(), GeminiSession.class);
        if (session.getMessages() == null) {
            return List.of();
        }
        String sessionId = session.getSessionId() != null ? session.getSessionId() : "unknown";
        String project = session.getProjectHash() != null && !session.getProjectHash().isEmpty()
                ? session.getProjectHash()
                : NAME;
        Instant fileTime = modificationTime(file);

        List<UsageRecord> records = new ArrayList<>();
        for (GeminiMessage message : session.getMessages()) {
            GeminiTokens tokens = message.getTokens();
            if (!NAME.equals(message.getType()) || tokens == null || message.getModel() == null) {
                continue;
            }
            long input = nonNegative(tokens.getInput());
            long output = nonNegative(tokens.getOutput());
            if (input == 0 && output == 0) {
                continue;
            }
            Instant timestamp = parseTimestamp(message.getTimestamp());
            String messageId = message.getId() != null ? message.getId() : "unknown";

            records.add(UsageRecord.builder()
                    .provider(NAME)
                    .sessionId(sessionId)
                    .timestamp(timestamp != null ? timestamp : fileTime)
                    .project(project)
                    .model(message.getModel())
                    .messageId(NAME + ":" + sessionId + ":" + messageId)
                    .inputTokens(input)
                    .outputTokens(output)
                    .cacheReadInputTokens(nonNegative(tokens.getCached()))
                    .build());
        }
        return records;
    }

    private Instant modificationTime(Path file) {
        try {
            return Instant.ofEpochSecond(Files.getLastModifiedTime(file).toMillis() / 1000);
        } catch (IOException e) {
            return clock.instant();
        }
    }

    private static long nonNegative(Long value) {
        return value != null && value > 0 ? value : 0L;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GeminiSession {
        private String sessionId;
        private String projectHash;
        private List<GeminiMessage> messages;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GeminiMessage {
        private String id;
        private String type;
        private String model;
        private GeminiTokens tokens;
        private String timestamp;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GeminiTokens {
        private Long input;
        private Long output;
        private Long cached;
    }
}
