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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-token USD rates for one model. Cache rates are optional; a null rate
 * means the model does not bill that token class separately.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelPricing {

    private double inputCostPerToken;
    private double outputCostPerToken;
    private Double cacheReadCostPerToken;
    private Double cacheCreationCostPerToken;

    public Cost costOf(UsageRecord record) {
        double total = record.getInputTokens() * inputCostPerToken
                + record.getOutputTokens() * outputCostPerToken;
        if (cacheReadCostPerToken != null) {
            total += record.getCacheReadInputTokens() * cacheReadCostPerToken;
        }
        if (cacheCreationCostPerToken != null) {
            total += record.getCacheCreationInputTokens() * cacheCreationCostPerToken;
        }
        return Cost.of(total);
    }
}
