package me.golemcore.tokens.domain.model;

/**
 * Receives {@code (completed, total)} file counts while a provider scans its
 * sources. Calls arrive on the coordinating thread with strictly increasing
 * {@code completed}.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(int completed, int total);
}
