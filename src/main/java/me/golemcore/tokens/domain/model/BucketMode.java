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

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.function.Function;

/**
 * How records are grouped into report buckets. Date keys are computed in UTC.
 */
public enum BucketMode {

    DAILY(record -> Formats.DAY.format(record.getTimestamp())),
    MONTHLY(record -> Formats.MONTH.format(record.getTimestamp())),
    SESSION(record -> record.getProject() + " | " + record.getSessionId()),
    MODEL(UsageRecord::getModel);

    private final Function<UsageRecord, String> keyFunction;

    BucketMode(Function<UsageRecord, String> keyFunction) {
        this.keyFunction = keyFunction;
    }

    public Function<UsageRecord, String> keyFunction() {
        return keyFunction;
    }

    public String keyOf(UsageRecord record) {
        return keyFunction.apply(record);
    }

    private static final class Formats {
        private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd")
                .withZone(ZoneOffset.UTC);
        private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM")
                .withZone(ZoneOffset.UTC);
    }
}
