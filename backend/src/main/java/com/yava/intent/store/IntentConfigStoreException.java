package com.yava.intent.store;

/**
 * The configuration backend could not be read or written.
 */
public class IntentConfigStoreException extends RuntimeException {

    public IntentConfigStoreException(String message) {
        super(message);
    }

    public IntentConfigStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
