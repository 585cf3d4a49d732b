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
import me.golemcore.tokens.domain.model.DiscoveredFile;
import me.golemcore.tokens.domain.model.UsageFileParser;
import me.golemcore.tokens.domain.model.UsageRecord;
import me.golemcore.tokens.domain.service.ParallelParsePipeline;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenCode storage: one JSON file per message under
 * {@code storage/message/<session>/} and one per session under
 * {@code storage/session/}.
 *
 * <p>
 * Session files are read once per run to map session ids to project names
 * before message files are parsed.
 */
@Component
@Order(5)
@Slf4j
public class OpenCodeUsageProvider extends AbstractFileUsageProvider {

    static final String NAME = "opencode";

    private final FileDiscovery fileDiscovery;
    private volatile Map<String, String> sessionProjects = Map.of();

    public OpenCodeUsageProvider(ProviderRootResolver rootResolver, FileDiscovery fileDiscovery,
            ParallelParsePipeline pipeline, ObjectMapper objectMapper) {
        super(NAME, "json", rootResolver, fileDiscovery, pipeline, objectMapper);
        this.fileDiscovery = fileDiscovery;
    }

    @Override
    protected List<Path> resolveRoots(ProviderRootResolver resolver) {
        return resolver.resolve("OPENCODE_DATA_DIR", "storage", List.of(DefaultRoot.data("opencode/storage")));
    }

    @Override
    protected List<Path> scanRoots(List<Path> roots) {
        return roots.stream().map(root -> root.resolve("message")).toList();
    }

    @Override
    protected UsageFileParser createFileParser(List<Path> roots) {
        sessionProjects = loadSessionProjects(roots);
        return super.createFileParser(roots);
    }

    @Override
    protected List<UsageRecord> parseFile(Path file) throws IOException {
        return parseMessage(readTree(file), sessionProjects);
    }

    Map<String, String> loadSessionProjects(List<Path> roots) {
        List<Path> sessionDirs = roots.stream().map(root -> root.resolve("session")).toList();
        Map<String, String> projects = new HashMap<>();
        for (DiscoveredFile file : fileDiscovery.discover(sessionDirs, "json")) {
            try {
                JsonNode session = readTree(file.path());
                String id = text(session, "id");
                if (id != null) {
                    projects.put(id, projectOf(session));
                }
            } catch (IOException e) {
                log.debug("[{}] Skipping session file {}: {}", NAME, file.path(), e.getMessage());
            }
        }
        return projects;
    }

    private static String projectOf(JsonNode session) {
        String directory = text(session, "directory");
        if (directory != null) {
            String basename = directory.substring(directory.lastIndexOf('/') + 1);
            if (!basename.isEmpty()) {
                return basename;
            }
        }
        return textOrDefault(session, "projectID", NAME);
    }

    private static List<UsageRecord> parseMessage(JsonNode message, Map<String, String> sessionProjects) {
        String id = text(message, "id");
        String model = text(message, "modelID");
        JsonNode created = message.path("time").path("created");
        JsonNode tokens = message.path("tokens");
        if (id == null || text(message, "providerID") == null || model == null
                || !created.isIntegralNumber() || !tokens.isObject()) {
            return List.of();
        }
        long input = count(tokens, "input");
        long output = count(tokens, "output");
        if (input == 0 && output == 0) {
            return List.of();
        }
        String sessionId = textOrDefault(message, "sessionID", "unknown");

        return List.of(UsageRecord.builder()
                .provider(NAME)
                .sessionId(sessionId)
                .timestamp(Instant.ofEpochMilli(created.asLong()))
                .project(sessionProjects.getOrDefault(sessionId, NAME))
                .model(model)
                .messageId(id)
                .inputTokens(input)
                .outputTokens(output)
                .cacheCreationInputTokens(count(tokens.path("cache"), "write"))
                .cacheReadInputTokens(count(tokens.path("cache"), "read"))
                .build());
    }
}
