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
import java.util.Arrays;
import java.util.List;

/**
 * Claude Code session logs: {@code ~/.claude/projects/<encoded-dir>/<session>.jsonl}.
 *
 * <p>
 * Usage comes from {@code assistant} lines and from sub-agent
 * {@code progress} lines (whose {@code data.type} is {@code agent_progress}).
 * The project is the basename of the line's {@code cwd}, else it is decoded
 * from the dash-encoded directory name under {@code projects}.
 */
@Component
@Order(1)
public class ClaudeUsageProvider extends AbstractFileUsageProvider {

    static final String NAME = "claude";
    private static final String SYNTHETIC_MODEL = "<synthetic>";
    private static final String UNKNOWN = "unknown";
    private static final List<String> PROJECT_MARKERS = List.of("projects", "src", "code", "repos", "workspace");

    public ClaudeUsageProvider(ProviderRootResolver rootResolver, FileDiscovery fileDiscovery,
            ParallelParsePipeline pipeline, ObjectMapper objectMapper) {
        super(NAME, "jsonl", rootResolver, fileDiscovery, pipeline, objectMapper);
    }

    @Override
    protected List<Path> resolveRoots(ProviderRootResolver resolver) {
        return resolver.resolve(null, null, List.of(
                DefaultRoot.home(".claude/projects"),
                DefaultRoot.config("claude/projects")));
    }

    @Override
    protected List<UsageRecord> parseFile(Path file) throws IOException {
        String sessionId = fileStem(file);
        String project = projectFromPath(file);
        return JsonlLineReader.readLines(file, "\"usage\"",
                line -> extractRecord(objectMapper.readTree(line), sessionId, project));
    }

    private UsageRecord extractRecord(JsonNode line, String sessionId, String directoryProject) {
        String type = text(line, "type");
        JsonNode message;
        String timestamp;
        String requestId;
        if ("assistant".equals(type)) {
            message = line.path("message");
            timestamp = text(line, "timestamp");
            requestId = text(line, "requestId");
        } else if ("progress".equals(type)) {
            JsonNode data = line.path("data");
            if (!"agent_progress".equals(text(data, "type"))) {
                return null;
            }
            JsonNode outer = data.path("message");
            message = outer.path("message");
            timestamp = textOrDefault(outer, "timestamp", text(line, "timestamp"));
            requestId = text(outer, "requestId");
        } else {
            return null;
        }

        JsonNode usage = message.path("usage");
        String model = text(message, "model");
        Instant instant = parseTimestamp(timestamp);
        if (!usage.isObject() || model == null || instant == null || SYNTHETIC_MODEL.equals(model)) {
            return null;
        }

        return UsageRecord.builder()
                .provider(NAME)
                .sessionId(sessionId)
                .timestamp(instant)
                .project(projectFromCwd(text(line, "cwd"), directoryProject))
                .model(model)
                .messageId(textOrDefault(message, "id", ""))
                .requestId(requestId != null ? requestId : "")
                .inputTokens(count(usage, "input_tokens"))
                .outputTokens(count(usage, "output_tokens"))
                .cacheCreationInputTokens(count(usage, "cache_creation_input_tokens"))
                .cacheReadInputTokens(count(usage, "cache_read_input_tokens"))
                .build();
    }

    private static String projectFromCwd(String cwd, String fallback) {
        if (cwd == null) {
            return fallback;
        }
        return cwd.substring(cwd.lastIndexOf('/') + 1);
    }

    /**
     * Finds the directory directly under {@code projects} and decodes it.
     */
    static String projectFromPath(Path file) {
        Path dir = file.getParent();
        while (dir != null) {
            Path parent = dir.getParent();
            if (parent != null && parent.getFileName() != null
                    && "projects".equals(parent.getFileName().toString()) && dir.getFileName() != null) {
                return decodeProjectName(dir.getFileName().toString());
            }
            dir = parent;
        }
        return UNKNOWN;
    }

    /**
     * Claude encodes the working directory by replacing separators with
     * dashes, e.g. {@code -home-alice-git-my-app}. The project is what follows
     * a {@code git} segment, else what follows a common source-root marker,
     * else what follows {@code home/<user>}, else the last segment.
     */
    static String decodeProjectName(String encoded) {
        List<String> parts = new ArrayList<>(Arrays.stream(encoded.split("-"))
                .filter(part -> !part.isEmpty())
                .toList());

        int gitIndex = parts.indexOf("git");
        if (gitIndex >= 0 && gitIndex + 1 < parts.size()) {
            return String.join("-", parts.subList(gitIndex + 1, parts.size()));
        }
        for (String marker : PROJECT_MARKERS) {
            int index = parts.indexOf(marker);
            if (index >= 0 && index + 1 < parts.size()) {
                return String.join("-", parts.subList(index + 1, parts.size()));
            }
        }
        if (parts.size() >= 3 && "home".equals(parts.get(0))) {
            return String.join("-", parts.subList(2, parts.size()));
        }
        return parts.isEmpty() ? UNKNOWN : parts.get(parts.size() - 1);
    }
}
