package me.golemcore.tokens.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.tokens.domain.exception.ParseInterruptedException;
import me.golemcore.tokens.domain.model.DiscoveredFile;
import me.golemcore.tokens.domain.model.ProgressListener;
import me.golemcore.tokens.domain.model.UsageFileParser;
import me.golemcore.tokens.domain.model.UsageRecord;
import me.golemcore.tokens.port.outbound.CacheStorePort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Incremental parse of a provider's discovered files.
 *
 * <p>
 * Runs in three phases:
 * <ol>
 * <li>sequential cache lookup; hits are reported as progress right away and
 * misses are collected in discovery order</li>
 * <li>parallel parse of the misses on the shared worker pool; workers only
 * run the parser and never see the cache</li>
 * <li>sequential commit of every result into the cache, in the order of
 * phase 1</li>
 * </ol>
 * Finally entries for files that no longer exist are pruned.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ParallelParsePipeline {

    private static final String LOG_PREFIX = "[Pipeline]";

    private final ExecutorService executor;

    public ParallelParsePipeline(@Qualifier("usageParseExecutor") ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * @throws ParseInterruptedException
     *             if the calling thread is interrupted while waiting for the
     *             workers
     */
    public void run(String providerName, List<DiscoveredFile> files, CacheStorePort cache,
            ProgressListener progress, UsageFileParser parser) {
        int total = files.size();
        int completed = 0;

        List<DiscoveredFile> misses = new ArrayList<>();
        for (DiscoveredFile file : files) {
            if (cache.isCached(providerName, file.path().toString(), file.fingerprint())) {
                completed++;
                report(progress, completed, total);
            } else {
                misses.add(file);
            }
        }
        int hits = completed;

        List<List<UsageRecord>> results = parseAll(providerName, misses, parser);

        for (int i = 0; i < misses.size(); i++) {
            DiscoveredFile file = misses.get(i);
            completed++;
            report(progress, completed, total);
            cache.insert(providerName, file.path().toString(), file.fingerprint(), results.get(i));
        }

        List<String> known = new ArrayList<>(files.size());
        for (DiscoveredFile file : files) {
            known.add(file.path().toString());
        }
        cache.prune(providerName, known);

        log.debug("{} {}: {} files, {} cached, {} parsed", LOG_PREFIX, providerName, total, hits, misses.size());
    }

    private List<List<UsageRecord>> parseAll(String providerName, List<DiscoveredFile> misses,
            UsageFileParser parser) {
        if (misses.isEmpty()) {
            return List.of();
        }
        List<Callable<List<UsageRecord>>> tasks = new ArrayList<>(misses.size());
        for (DiscoveredFile file : misses) {
            tasks.add(() -> parser.parse(file.path()));
        }

        List<Future<List<UsageRecord>>> futures;
        try {
            futures = executor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ParseInterruptedException("Interrupted while parsing " + providerName + " files", e);
        }

        List<List<UsageRecord>> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(resultOf(futures.get(i), misses.get(i)));
        }
        return results;
    }

    private List<UsageRecord> resultOf(Future<List<UsageRecord>> future, DiscoveredFile file) {
        try {
            List<UsageRecord> records = future.get();
            return records != null ? records : List.of();
        } catch (ExecutionException e) {
            log.warn("{} Parser failed for {}: {}", LOG_PREFIX, file.path(), e.getCause().toString());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ParseInterruptedException("Interrupted while collecting parse results", e);
        }
    }

    private static void report(ProgressListener progress, int completed, int total) {
        if (progress != null) {
            progress.onProgress(completed, total);
        }
    }
}
