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

import java.time.Instant;

/**
 * Canonical usage event produced by every provider.
 *
 * <p>
 * {@code (provider, messageId, requestId)} is the natural identity of a record
 * and is what deduplication keys on. String fields default to the empty
 * string and token counts to zero; the timestamp is always present.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UsageRecord {

    @Builder.Default
    private String provider = "";
    @Builder.Default
    private String sessionId = "";
    private Instant timestamp;
    @Builder.Default
    private String project = "";
    @Builder.Default
    private String model = "";
    @Builder.Default
    private String messageId = "";
    @Builder.Default
    private String requestId = "";
    private long inputTokens;
    private long outputTokens;
    private long cacheCreationInputTokens;
    private long cacheReadInputTokens;

    public long getTotalTokens() {
        return inputTokens + outputTokens + cacheCreationInputTokens + cacheReadInputTokens;
    }
}
