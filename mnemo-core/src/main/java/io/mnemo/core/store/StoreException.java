package io.mnemo.core.store;

import java.io.IOException;

/**
 * Underlying persistence failure. The write that raised it had no effect.
 */
public class StoreException extends IOException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
