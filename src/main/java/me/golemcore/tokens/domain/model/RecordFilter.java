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

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Report filter: inclusive UTC date range with open ends, case-insensitive
 * project substring and case-insensitive exact tool (provider) id.
 */
public final class RecordFilter implements Predicate<UsageRecord> {

    private final LocalDate from;
    private final LocalDate to;
    private final String project;
    private final String tool;

    private RecordFilter(LocalDate from, LocalDate to, String project, String tool) {
        this.from = from;
        this.to = to;
        this.project = project;
        this.tool = tool;
    }

    public static RecordFilter none() {
        return new RecordFilter(null, null, null, null);
    }

    /**
     * Builds a filter from raw option values. Blank values leave that criterion
     * open.
     *
     * @throws IllegalArgumentException
     *             when a date is not {@code yyyy-MM-dd}
     */
    public static RecordFilter of(String from, String to, String project, String tool) {
        return new RecordFilter(parseDate(from, "from"), parseDate(to, "to"),
                blankToNull(project), blankToNull(tool));
    }

    @Override
    public boolean test(UsageRecord record) {
        LocalDate day = record.getTimestamp().atOffset(ZoneOffset.UTC).toLocalDate();
        if (from != null && day.isBefore(from)) {
            return false;
        }
        if (to != null && day.isAfter(to)) {
            return false;
        }
        if (project != null && !record.getProject().toLowerCase(Locale.ROOT)
                .contains(project.toLowerCase(Locale.ROOT))) {
            return false;
        }
        return tool == null || record.getProvider().equalsIgnoreCase(tool);
    }

    public boolean isEmpty() {
        return from == null && to == null && project == null && tool == null;
    }

    private static LocalDate parseDate(String value, String name) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid '" + name + "' date: " + value, e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
