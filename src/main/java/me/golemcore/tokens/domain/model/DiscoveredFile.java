package me.golemcore.tokens.domain.model;

import java.nio.file.Path;

/**
 * A candidate source file found under a provider root.
 */
public record DiscoveredFile(Path path, FileFingerprint fingerprint) {
}
