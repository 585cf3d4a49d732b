package me.golemcore.tokens.domain.model;

/**
 * Change detector for a source file: modification time truncated to seconds
 * plus byte size. Two fingerprints match only when both parts are equal.
 */
public record FileFingerprint(long mtimeSeconds, long sizeBytes) {
}
