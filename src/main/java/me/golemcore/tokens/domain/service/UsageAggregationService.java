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

import me.golemcore.tokens.domain.model.AggregatedBucket;
import me.golemcore.tokens.domain.model.Cost;
import me.golemcore.tokens.domain.model.UsageRecord;
import me.golemcore.tokens.port.outbound.PricingLookup;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Groups records into buckets and sums tokens and cost per bucket and per
 * model.
 */
@Service
public class UsageAggregationService {

    /**
     * @return buckets ordered by key, each finished (details sorted by
     *         descending cost)
     */
    public SortedMap<String, AggregatedBucket> aggregate(Collection<UsageRecord> records,
            Function<UsageRecord, String> bucketKey, PricingLookup pricing) {
        SortedMap<String, AggregatedBucket> buckets = new TreeMap<>();
        for (UsageRecord record : records) {
            Cost cost = pricing.costForRecord(record);
            buckets.computeIfAbsent(bucketKey.apply(record), key -> new AggregatedBucket()).add(record, cost);
        }
        buckets.values().forEach(AggregatedBucket::finish);
        return buckets;
    }

    /**
     * Folds all buckets into one total.
     */
    public AggregatedBucket total(Collection<AggregatedBucket> buckets) {
        AggregatedBucket total = new AggregatedBucket();
        for (AggregatedBucket bucket : buckets) {
            total.accumulateFrom(bucket);
        }
        return total.finish();
    }
}
