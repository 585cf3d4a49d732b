package me.golemcore.tokens.domain.exception;

/**
 * Thrown when the thread running a scan is interrupted while waiting for parse
 * workers. The interrupt flag is restored before this is thrown.
 */
public class ParseInterruptedException extends RuntimeException {

    public ParseInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
