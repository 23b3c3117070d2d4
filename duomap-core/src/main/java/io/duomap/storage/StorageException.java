package io.duomap.storage;

import io.duomap.core.DuomapException;

/**
 * Failure reported by a storage engine: missing tables, constraint violations,
 * identifier problems. The mapping core passes these through untouched.
 */
public class StorageException extends DuomapException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
