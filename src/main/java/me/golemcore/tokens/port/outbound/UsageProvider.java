package me.golemcore.tokens.port.outbound;

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

import me.golemcore.tokens.domain.model.ProgressListener;

import java.nio.file.Path;
import java.util.List;

/**
 * Source of usage records for one AI coding tool.
 *
 * <p>
 * A provider discovers its log files, reuses cached parse results for files
 * whose fingerprint did not change, parses the rest and commits the results
 * into the cache. Records are collected afterwards with
 * {@link CacheStorePort#drainAll()}.
 *
 * @since 1.0
 */
public interface UsageProvider {

    /**
     * Stable lowercase id, also used as the cache namespace.
     */
    String getName();

    /**
     * Scans, parses changed files and updates the cache.
     *
     * @param progress
     *            optional listener, may be null
     */
    void discoverAndParse(CacheStorePort cache, ProgressListener progress);

    /**
     * Directories this provider scans on this machine.
     */
    List<Path> getRootDirectories();
}
