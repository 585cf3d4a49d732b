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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tokens.domain.exception.ParseInterruptedException;
import me.golemcore.tokens.domain.model.AggregatedBucket;
import me.golemcore.tokens.domain.model.BucketMode;
import me.golemcore.tokens.domain.model.ProgressListener;
import me.golemcore.tokens.domain.model.RecordFilter;
import me.golemcore.tokens.domain.model.UsageRecord;
import me.golemcore.tokens.domain.model.UsageReport;
import me.golemcore.tokens.port.outbound.CacheStorePort;
import me.golemcore.tokens.port.outbound.PricingLookup;
import me.golemcore.tokens.port.outbound.UsageProvider;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;

/**
 * Runs every provider against the cache, then deduplicates, filters and
 * aggregates the merged records.
 *
 * <p>
 * Providers run in their registration order, which fixes the order dedup sees
 * records in and therefore which duplicate survives.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UsageReportService {

    private static final String LOG_PREFIX = "[Report]";

    private final List<UsageProvider> providers;
    private final CacheStorePort cacheStore;
    private final DedupService dedupService;
    private final UsageAggregationService aggregationService;
    private final PricingLookup pricingLookup;

    /**
     * Scans all providers, persists the cache and returns the deduplicated
     * records.
     */
    public List<UsageRecord> loadRecords(boolean logProgress) {
        for (UsageProvider provider : providers) {
            ProgressListener progress = logProgress ? progressLogger(provider.getName()) : null;
            try {
                provider.discoverAndParse(cacheStore, progress);
            } catch (ParseInterruptedException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("{} Provider {} failed, its records are skipped: {}", LOG_PREFIX, provider.getName(),
                        e.getMessage());
            }
        }
        cacheStore.flush();
        List<UsageRecord> merged = cacheStore.drainAll();
        List<UsageRecord> unique = dedupService.dedup(merged);
        log.info("{} Loaded {} records ({} after dedup) from {} providers via {} cache", LOG_PREFIX,
                merged.size(), unique.size(), providers.size(), cacheStore.getBackendName());
        return unique;
    }

    public UsageReport buildReport(BucketMode mode, RecordFilter filter, boolean logProgress) {
        List<UsageRecord> records = new ArrayList<>();
        for (UsageRecord record : loadRecords(logProgress)) {
            if (filter.test(record)) {
                records.add(record);
            }
        }

        List<String> unpriced = pricingLookup.unpricedModels(records);
        SortedMap<String, AggregatedBucket> buckets = aggregationService.aggregate(records, mode.keyFunction(),
                pricingLookup);
        return UsageReport.builder()
                .mode(mode)
                .recordCount(records.size())
                .buckets(buckets)
                .total(aggregationService.total(buckets.values()))
                .unpricedModels(unpriced)
                .build();
    }

    private ProgressListener progressLogger(String providerName) {
        return (completed, total) -> {
            if (completed == total) {
                log.info("{} {}: scanned {} files", LOG_PREFIX, providerName, total);
            } else {
                log.debug("{} {}: {}/{}", LOG_PREFIX, providerName, completed, total);
            }
        };
    }
}
