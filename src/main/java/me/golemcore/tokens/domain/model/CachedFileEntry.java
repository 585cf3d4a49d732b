package me.golemcore.tokens.domain.model;

import java.util.List;

/**
 * Cached parse result of one source file: the fingerprint the file had when
 * parsed and every record parsed from it.
 */
public record CachedFileEntry(FileFingerprint fingerprint, List<UsageRecord> records) {

    public CachedFileEntry {
        records = List.copyOf(records);
    }
}
