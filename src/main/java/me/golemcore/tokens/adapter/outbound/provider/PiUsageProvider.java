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
import java.util.List;

/**
 * Pi coding agent sessions:
 * {@code ~/.pi/agent/sessions/<project>/<timestamp>_<session>.jsonl}.
 */
@Component
@Order(3)
public class PiUsageProvider extends AbstractFileUsageProvider {

    static final String NAME = "pi";
    private static final String SESSIONS_SEGMENT = "/sessions/";

    public PiUsageProvider(ProviderRootResolver rootResolver, FileDiscovery fileDiscovery,
            ParallelParsePipeline pipeline, ObjectMapper objectMapper) {
        super(NAME, "jsonl", rootResolver, fileDiscovery, pipeline, objectMapper);
    }

    @Override
    protected List<Path> resolveRoots(ProviderRootResolver resolver) {
        return resolver.resolve("PI_AGENT_DIR", "sessions", List.of(
                DefaultRoot.home(".pi/agent/sessions"),
                DefaultRoot.config("pi/agent/sessions")));
    }

    @Override
    protected List<UsageRecord> parseFile(Path file) throws IOException {
        String sessionId = sessionIdFromPath(file);
        String project = projectFromPath(file);
        return JsonlLineReader.readLines(file, "\"assistant\"",
                line -> extractRecord(objectMapper.readTree(line), sessionId, project));
    }

    private UsageRecord extractRecord(JsonNode line, String sessionId, String project) {
        Instant timestamp = parseTimestamp(text(line, "timestamp"));
        JsonNode message = line.path("message");
        if (timestamp == null || !"assistant".equals(text(message, "role"))) {
            return null;
        }
        JsonNode usage = message.path("usage");
        if (!isCount(usage.path("input")) || !isCount(usage.path("output"))) {
            return null;
        }
        long input = usage.path("input").asLong();
        long output = usage.path("output").asLong();

        return UsageRecord.builder()
                .provider(NAME)
                .sessionId(sessionId)
                .timestamp(timestamp)
                .project(project)
                .model(textOrDefault(message, "model", "unknown"))
                .messageId(NAME + ":" + sessionId + ":" + timestamp + ":" + input + ":" + output)
                .inputTokens(input)
                .outputTokens(output)
                .cacheCreationInputTokens(count(usage, "cacheWrite"))
                .cacheReadInputTokens(count(usage, "cacheRead"))
                .build();
    }

    /**
     * The part of the file stem after the first underscore.
     */
    static String sessionIdFromPath(Path file) {
        String stem = fileStem(file);
        int underscore = stem.indexOf('_');
        if (underscore >= 0 && underscore + 1 < stem.length()) {
            return stem.substring(underscore + 1);
        }
        return stem;
    }

    static String projectFromPath(Path file) {
        String path = normalizedPath(file);
        int index = path.indexOf(SESSIONS_SEGMENT);
        if (index >= 0) {
            String after = path.substring(index + SESSIONS_SEGMENT.length());
            int slash = after.indexOf('/');
            if (slash > 0) {
                return after.substring(0, slash);
            }
        }
        return NAME;
    }
}
