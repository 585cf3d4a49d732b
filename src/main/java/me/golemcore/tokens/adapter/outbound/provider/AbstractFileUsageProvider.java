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
import me.golemcore.tokens.domain.model.DiscoveredFile;
import me.golemcore.tokens.domain.model.ProgressListener;
import me.golemcore.tokens.domain.model.UsageFileParser;
import me.golemcore.tokens.domain.model.UsageRecord;
import me.golemcore.tokens.domain.service.ParallelParsePipeline;
import me.golemcore.tokens.port.outbound.CacheStorePort;
import me.golemcore.tokens.port.outbound.UsageProvider;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Base for providers that read one tool's log files from local directories.
 *
 * <p>
 * Subclasses supply the roots and a per-file parser; discovery, the cache
 * lookup, parallel parsing and pruning are shared. {@link #parseFile(Path)}
 * may throw: failures are logged and the file contributes no records.
 *
 * @since 1.0
 */
@Slf4j
public abstract class AbstractFileUsageProvider implements UsageProvider {

    private final String name;
    private final String extension;
    private final ProviderRootResolver rootResolver;
    private final FileDiscovery fileDiscovery;
    private final ParallelParsePipeline pipeline;
    protected final ObjectMapper objectMapper;

    protected AbstractFileUsageProvider(String name, String extension, ProviderRootResolver rootResolver,
            FileDiscovery fileDiscovery, ParallelParsePipeline pipeline, ObjectMapper objectMapper) {
        this.name = name;
        this.extension = extension;
        this.rootResolver = rootResolver;
        this.fileDiscovery = fileDiscovery;
        this.pipeline = pipeline;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<Path> getRootDirectories() {
        return resolveRoots(rootResolver);
    }

    @Override
    public void discoverAndParse(CacheStorePort cache, ProgressListener progress) {
        List<Path> roots = getRootDirectories();
        List<DiscoveredFile> files = fileDiscovery.discover(scanRoots(roots), extension);
        log.debug("[{}] Discovered {} .{} files under {}", name, files.size(), extension, roots);
        pipeline.run(name, files, cache, progress, createFileParser(roots));
    }

    protected abstract List<Path> resolveRoots(ProviderRootResolver resolver);

    /**
     * Directories actually walked for candidate files. Defaults to the roots.
     */
    protected List<Path> scanRoots(List<Path> roots) {
        return roots;
    }

    /**
     * Builds the parser used for this run. Providers that need run-wide context
     * (such as session metadata) load it here, before parsing starts.
     */
    protected UsageFileParser createFileParser(List<Path> roots) {
        return this::parseQuietly;
    }

    protected abstract List<UsageRecord> parseFile(Path file) throws IOException;

    protected final List<UsageRecord> parseQuietly(Path file) {
        try {
            return parseFile(file);
        } catch (IOException | RuntimeException e) { // NOSONAR
            log.debug("[{}] Failed to parse {}: {}", name, file, e.getMessage());
            return List.of();
        }
    }

    protected JsonNode readTree(Path file) throws IOException {
        return objectMapper.readTree(file.toFile());
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : null;
    }

    protected static String textOrDefault(JsonNode node, String field, String defaultValue) {
        String value = text(node, field);
        return value != null ? value : defaultValue;
    }

    /**
     * @return the non-negative integer value, or 0 when absent or not a count
     */
    protected static long count(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return isCount(value) ? value.asLong() : 0L;
    }

    protected static boolean isCount(JsonNode value) {
        return value.isIntegralNumber() && value.canConvertToLong() && value.asLong() >= 0;
    }

    /**
     * Parses an RFC 3339 timestamp.
     *
     * @return the instant, or null when absent or malformed
     */
    protected static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException ignored) { // NOSONAR
                return null;
            }
        }
    }

    /**
     * Path as a forward-slash string, for substring-based layout parsing.
     */
    protected static String normalizedPath(Path file) {
        return file.toString().replace('\\', '/');
    }

    protected static String fileStem(Path file) {
        String fileName = file.getFileName() != null ? file.getFileName().toString() : "";
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
