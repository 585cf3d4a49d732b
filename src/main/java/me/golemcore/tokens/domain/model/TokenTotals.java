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
 * Running token sums plus cost shared by bucket totals and per-model details.
 */
@Getter
public abstract class TokenTotals {

    private long inputTokens;
    private long outputTokens;
    private long cacheCreationInputTokens;
    private long cacheReadInputTokens;
    private Cost cost = Cost.undefined();

    protected void addRecord(UsageRecord record, Cost recordCost) {
        inputTokens += record.getInputTokens();
        outputTokens += record.getOutputTokens();
        cacheCreationInputTokens += record.getCacheCreationInputTokens();
        cacheReadInputTokens += record.getCacheReadInputTokens();
        cost = cost.plus(recordCost);
    }

    protected void addTotals(TokenTotals other) {
        inputTokens += other.inputTokens;
        outputTokens += other.outputTokens;
        cacheCreationInputTokens += other.cacheCreationInputTokens;
        cacheReadInputTokens += other.cacheReadInputTokens;
        cost = cost.plus(other.cost);
    }

    public long getTotalTokens() {
        return inputTokens + outputTokens + cacheCreationInputTokens + cacheReadInputTokens;
    }
}
