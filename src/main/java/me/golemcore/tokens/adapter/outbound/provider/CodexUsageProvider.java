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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tokens.adapter.outbound.provider.ProviderRootResolver.DefaultRoot;
import me.golemcore.tokens.domain.model.UsageRecord;
import me.golemcore.tokens.domain.service.ParallelParsePipeline;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * OpenAI Codex CLI rollouts: {@code ~/.codex/sessions/YYYY/MM/DD/rollout-*.jsonl}.
 *
 * <p>
 * {@code turn_context} lines set the current model; {@code token_count}
 * events carry usage. Each event's {@code last_token_usage} is used when
 * present, otherwise the growth of {@code total_token_usage} since the
 * previous event. The file is read sequentially because of that state.
 */
@Component
@Order(2)
@Slf4j
public class CodexUsageProvider extends AbstractFileUsageProvider {

    static final String NAME = "codex";
    private static final String DEFAULT_MODEL = "gpt-5";
    private static final String SESSIONS_SEGMENT = "/sessions/";

    public CodexUsageProvider(ProviderRootResolver rootResolver, FileDiscovery fileDiscovery,
            ParallelParsePipeline pipeline, ObjectMapper objectMapper) {
        super(NAME, "jsonl", rootResolver, fileDiscovery, pipeline, objectMapper);
    }

    @Override
    protected List<Path> resolveRoots(ProviderRootResolver resolver) {
        return resolver.resolve("CODEX_HOME", "sessions", List.of(
                DefaultRoot.home(".codex/sessions"),
                DefaultRoot.config("codex/sessions")));
    }

    @Override
    protected List<UsageRecord> parseFile(Path file) throws IOException {
        String sessionId = sessionIdFromPath(file);
        String project = projectFromSessionId(sessionId);
        FileState state = new FileState();
        List<UsageRecord> records = new ArrayList<>();

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.contains("\"turn_context\"")) {
                    JsonNode parsed = readLine(line);
                    String model = parsed != null ? modelOf(parsed.path("payload")) : null;
                    if (model != null) {
                        state.lastModel = model;
                    }
                } else if (line.contains("\"token_count\"")) {
                    JsonNode parsed = readLine(line);
                    UsageRecord record = parsed != null ? extractTokenEvent(parsed, sessionId, project, state) : null;
                    if (record != null) {
                        records.add(record);
                    }
                }
            }
        }
        return records;
    }

    private JsonNode readLine(String line) {
        try {
            return objectMapper.readTree(line);
        } catch (IOException e) {
            log.trace("[{}] Skipping malformed line: {}", NAME, e.getMessage());
            return null;
        }
    }

    private UsageRecord extractTokenEvent(JsonNode parsed, String sessionId, String project, FileState state) {
        JsonNode payload = parsed.path("payload");
        if (!"token_count".equals(text(payload, "type"))) {
            return null;
        }
        JsonNode info = payload.path("info");
        Instant timestamp = parseTimestamp(text(parsed, "timestamp"));
        if (!info.isObject() || timestamp == null) {
            return null;
        }

        String model = modelOf(payload);
        if (model == null) {
            model = state.lastModel != null ? state.lastModel : DEFAULT_MODEL;
        }

        long input;
        long output;
        long cached;
        JsonNode last = info.path("last_token_usage");
        JsonNode total = info.path("total_token_usage");
        if (!last.isMissingNode() && !last.isNull()) {
            input = count(last, "input_tokens");
            output = count(last, "output_tokens");
            cached = cachedTokens(last);
        } else if (!total.isMissingNode() && !total.isNull()) {
            long currentInput = count(total, "input_tokens");
            long currentOutput = count(total, "output_tokens");
            long currentCached = cachedTokens(total);
            input = Math.max(0, currentInput - state.totalInput);
            output = Math.max(0, currentOutput - state.totalOutput);
            cached = Math.max(0, currentCached - state.totalCached);
            state.totalInput = currentInput;
            state.totalOutput = currentOutput;
            state.totalCached = currentCached;
        } else {
            return null;
        }

        if (input == 0 && output == 0 && cached == 0) {
            return null;
        }

        return UsageRecord.builder()
                .provider(NAME)
                .sessionId(sessionId)
                .timestamp(timestamp)
                .project(project)
                .model(model)
                .messageId(NAME + ":" + sessionId + ":" + timestamp + ":" + input + ":" + output)
                .inputTokens(input)
                .outputTokens(output)
                .cacheReadInputTokens(cached)
                .build();
    }

    private static long cachedTokens(JsonNode usage) {
        if (usage.has("cached_input_tokens")) {
            return count(usage, "cached_input_tokens");
        }
        return count(usage, "cache_read_input_tokens");
    }

    /**
     * Looks up {@code info.model}, {@code info.metadata.model}, {@code model}
     * and {@code metadata.model} of a payload, in that order.
     */
    static String modelOf(JsonNode node) {
        for (JsonNode candidate : List.of(node.path("info").path("model"),
                node.path("info").path("metadata").path("model"),
                node.path("model"),
                node.path("metadata").path("model"))) {
            if (candidate.isTextual()) {
                return candidate.asText();
            }
        }
        return null;
    }

    static String sessionIdFromPath(Path file) {
        String path = normalizedPath(file);
        int index = path.indexOf(SESSIONS_SEGMENT);
        if (index >= 0) {
            String relative = path.substring(index + SESSIONS_SEGMENT.length());
            return relative.endsWith(".jsonl") ? relative.substring(0, relative.length() - ".jsonl".length())
                    : relative;
        }
        return fileStem(file);
    }

    static String projectFromSessionId(String sessionId) {
        int slash = sessionId.indexOf('/');
        String first = slash >= 0 ? sessionId.substring(0, slash) : sessionId;
        return first.isEmpty() ? NAME : first;
    }

    private static final class FileState {
        private String lastModel;
        private long totalInput;
        private long totalOutput;
        private long totalCached;
    }
}
