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

/**
 * Token and cost sums for one model inside a bucket.
 */
@Getter
public class ModelBucketDetail extends TokenTotals {

    private final String model;

    public ModelBucketDetail(String model) {
        this.model = model;
    }

    public void add(UsageRecord record, Cost recordCost) {
        addRecord(record, recordCost);
    }

    public void merge(ModelBucketDetail other) {
        addTotals(other);
    }
}
