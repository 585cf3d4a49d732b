package me.golemcore.tokens.domain.exception;

/**
 * Thrown when the parse cache cannot be opened or initialized.
 */
public class CacheStoreException extends RuntimeException {

    public CacheStoreException(String message) {
        super(message);
    }

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
