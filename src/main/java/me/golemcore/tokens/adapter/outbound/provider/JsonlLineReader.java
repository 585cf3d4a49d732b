package me.golemcore.tokens.adapter.outbound.provider;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Line-by-line reader for JSONL session logs.
 *
 * <p>
 * Lines that do not contain the filter substring are skipped without being
 * parsed. A line the extractor rejects (returns null) or fails on is skipped;
 * the rest of the file is still read. Invalid UTF-8 is replaced rather than
 * failing the file.
 */
@Slf4j
public final class JsonlLineReader {

    /**
     * Converts one line into a value, or returns null to skip it.
     */
    @FunctionalInterface
    public interface LineExtractor<T> {
        T extract(String line) throws IOException;
    }

    private JsonlLineReader() {
    }

    public static <T> List<T> readLines(Path file, String filter, LineExtractor<T> extractor) throws IOException {
        List<T> results = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank() || (filter != null && !line.contains(filter))) {
                    continue;
                }
                try {
                    T value = extractor.extract(line);
                    if (value != null) {
                        results.add(value);
                    }
                } catch (IOException | RuntimeException e) { // NOSONAR
                    log.trace("Skipping malformed line {} in {}: {}", lineNumber, file, e.getMessage());
                }
            }
        }
        return results;
    }
}
