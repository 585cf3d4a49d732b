package me.golemcore.tokens.domain.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Parses one source file into usage records.
 *
 * <p>
 * Implementations must be safe to call concurrently for different files and
 * must not throw: unreadable or malformed input yields an empty list.
 */
@FunctionalInterface
public interface UsageFileParser {

    List<UsageRecord> parse(Path file);
}
