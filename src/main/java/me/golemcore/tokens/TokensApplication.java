package me.golemcore.tokens;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Tokens.
 *
 * <p>
 * GolemCore Tokens reads the local usage logs written by AI coding assistants
 * and reports token consumption and cost.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Multi-Tool Support</b> - Claude Code, Codex, Pi, Amp, OpenCode and
 * Gemini CLI session logs</li>
 * <li><b>Incremental Cache</b> - per-file parse results keyed by modification
 * time and size, persisted as protobuf blobs or in SQLite</li>
 * <li><b>Parallel Parsing</b> - only changed files are parsed, on a bounded
 * worker pool</li>
 * <li><b>Cost Reporting</b> - LiteLLM pricing table, daily / monthly / session
 * / model buckets with per-model breakdown</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → UsageReportRunner
 * Domain Layer       → ParallelParsePipeline, DedupService, UsageAggregationService
 * Infrastructure     → Usage providers, cache stores, pricing catalog
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code tokens.*}
 * prefix; every property can be overridden on the command line, e.g.
 * {@code --tokens.report.mode=monthly}.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class TokensApplication {

    public static void main(String[] args) {
        SpringApplication.run(TokensApplication.class, args);
    }

}
