package me.golemcore.tokens.infrastructure.config;

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

import lombok.Data;
import me.golemcore.tokens.domain.model.BucketMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code tokens.*} prefix:
 * <ul>
 * <li>{@link CacheProperties} - parse cache backend and location</li>
 * <li>{@link ParseProperties} - worker pool sizing</li>
 * <li>{@link ReportProperties} - bucketing mode and record filters</li>
 * <li>{@link PricingProperties} - pricing table location</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "tokens")
@Data
public class TokensProperties {

    private CacheProperties cache = new CacheProperties();
    private ParseProperties parse = new ParseProperties();
    private ReportProperties report = new ReportProperties();
    private PricingProperties pricing = new PricingProperties();

    public enum CacheBackend {
        BLOB, SQLITE
    }

    @Data
    public static class CacheProperties {
        private CacheBackend backend = CacheBackend.BLOB;
        /**
         * Blank means {@code $XDG_CACHE_HOME/golemcore-tokens}, falling back to
         * {@code ~/.cache/golemcore-tokens}.
         */
        private String directory = "";
    }

    @Data
    public static class ParseProperties {
        /**
         * Worker threads for parsing changed files; 0 uses all available
         * processors.
         */
        private int threads = 0;
    }

    @Data
    public static class ReportProperties {
        private boolean enabled = true;
        private BucketMode mode = BucketMode.DAILY;
        private String from = "";
        private String to = "";
        private String project = "";
        private String tool = "";
        private boolean progress = true;
    }

    @Data
    public static class PricingProperties {
        /**
         * LiteLLM-format JSON table. Blank means {@code <cache-dir>/pricing.json},
         * falling back to the bundled classpath table.
         */
        private String file = "";
    }
}
