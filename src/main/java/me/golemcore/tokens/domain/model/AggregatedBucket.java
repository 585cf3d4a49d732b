package me.golemcore.tokens.domain.model;

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

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Aggregated usage for one bucket key (a day, a month, a session or a model).
 *
 * <p>
 * Records are added with {@link #add(UsageRecord, Cost)} and the bucket is
 * sealed with {@link #finish()}, which orders the per-model details by
 * descending cost and derives the display model names from that order.
 */
public class AggregatedBucket extends TokenTotals {

    private final Map<String, ModelBucketDetail> detailsByModel = new LinkedHashMap<>();
    private final Set<String> projects = new TreeSet<>();
    private final Set<String> tools = new TreeSet<>();

    @Getter
    private List<ModelBucketDetail> modelDetails = List.of();
    @Getter
    private List<String> models = List.of();

    public void add(UsageRecord record, Cost recordCost) {
        addRecord(record, recordCost);
        detailsByModel.computeIfAbsent(record.getModel(), ModelBucketDetail::new).add(record, recordCost);
        projects.add(record.getProject());
        tools.add(record.getProvider());
    }

    /**
     * Folds another bucket into this one, as used for the report total row.
     */
    public void accumulateFrom(AggregatedBucket other) {
        addTotals(other);
        for (ModelBucketDetail detail : other.detailsByModel.values()) {
            detailsByModel.computeIfAbsent(detail.getModel(), ModelBucketDetail::new).merge(detail);
        }
        projects.addAll(other.projects);
        tools.addAll(other.tools);
        finish();
    }

    public AggregatedBucket finish() {
        List<ModelBucketDetail> sorted = new ArrayList<>(detailsByModel.values());
        // List.sort is stable, equal costs keep first-seen order
        sorted.sort(Comparator.comparing(ModelBucketDetail::getCost).reversed());
        modelDetails = Collections.unmodifiableList(sorted);

        // one display name per detail, even when short names coincide
        models = sorted.stream()
                .map(detail -> ModelNames.shortName(detail.getModel()))
                .toList();
        return this;
    }

    public Set<String> getProjects() {
        return Collections.unmodifiableSet(projects);
    }

    public Set<String> getTools() {
        return Collections.unmodifiableSet(tools);
    }
}
