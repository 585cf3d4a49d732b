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

import me.golemcore.tokens.domain.model.FileFingerprint;
import me.golemcore.tokens.domain.model.UsageRecord;

import java.util.Collection;
import java.util.List;

/**
 * Port for the per-file parse cache.
 *
 * <p>
 * Entries are keyed by {@code (provider, path)} and hold the fingerprint the
 * file had when parsed plus every record parsed from it. An entry is always
 * replaced whole, never merged.
 *
 * <p>
 * Implementations are driven from a single coordinating thread and need not
 * be thread-safe.
 *
 * @since 1.0
 */
public interface CacheStorePort extends AutoCloseable {

    /**
     * @return true only if an entry exists whose stored fingerprint equals the
     *         given one exactly
     */
    boolean isCached(String provider, String path, FileFingerprint fingerprint);

    /**
     * Replaces the entry for {@code (provider, path)}.
     */
    void insert(String provider, String path, FileFingerprint fingerprint, List<UsageRecord> records);

    /**
     * Removes every entry of the provider whose path is not in
     * {@code knownPaths}.
     */
    void prune(String provider, Collection<String> knownPaths);

    /**
     * Persists pending changes. No-op when nothing changed.
     */
    void flush();

    /**
     * Returns every cached record across every provider touched or persisted,
     * and releases the in-memory copies. Called once per run, after
     * {@link #flush()}.
     */
    List<UsageRecord> drainAll();

    String getBackendName();

    @Override
    default void close() {
    }
}
