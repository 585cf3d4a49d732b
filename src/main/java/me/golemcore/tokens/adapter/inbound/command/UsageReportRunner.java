package me.golemcore.tokens.adapter.inbound.command;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.tokens.domain.model.RecordFilter;
import me.golemcore.tokens.domain.model.UsageReport;
import me.golemcore.tokens.domain.service.UsageReportService;
import me.golemcore.tokens.infrastructure.config.TokensProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;

/**
 * Runs one report on startup and prints it to stdout.
 *
 * <p>
 * Options come from {@code tokens.report.*}, so they can be given on the
 * command line, e.g. {@code --tokens.report.mode=monthly
 * --tokens.report.from=2026-01-01}. Logs go to stderr and do not mix with the
 * JSON output.
 */
@Component
@ConditionalOnProperty(prefix = "tokens.report", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class UsageReportRunner implements ApplicationRunner {

    private static final String LOG_PREFIX = "[Report]";

    private final UsageReportService reportService;
    private final JsonReportRenderer renderer;
    private final TokensProperties properties;
    private final PrintStream out;

    @Autowired
    public UsageReportRunner(UsageReportService reportService, JsonReportRenderer renderer,
            TokensProperties properties) {
        this(reportService, renderer, properties, System.out);
    }

    UsageReportRunner(UsageReportService reportService, JsonReportRenderer renderer, TokensProperties properties,
            PrintStream out) {
        this.reportService = reportService;
        this.renderer = renderer;
        this.properties = properties;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        TokensProperties.ReportProperties options = properties.getReport();
        RecordFilter filter = RecordFilter.of(options.getFrom(), options.getTo(), options.getProject(),
                options.getTool());

        UsageReport report = reportService.buildReport(options.getMode(), filter, options.isProgress());
        if (report.isEmpty()) {
            log.info("No usage records found.");
            return;
        }
        if (!report.getUnpricedModels().isEmpty()) {
            log.warn("{} No pricing for {} model(s), their cost is omitted: {}", LOG_PREFIX,
                    report.getUnpricedModels().size(), String.join(", ", report.getUnpricedModels()));
        }
        out.println(renderer.render(report));
        out.flush();
    }
}
