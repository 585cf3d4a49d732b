package me.golemcore.tokens.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.SortedMap;

/**
 * Result of one reporting run.
 */
@Value
@Builder
public class UsageReport {

    BucketMode mode;
    int recordCount;
    SortedMap<String, AggregatedBucket> buckets;
    AggregatedBucket total;
    List<String> unpricedModels;

    public boolean isEmpty() {
        return recordCount == 0;
    }
}
