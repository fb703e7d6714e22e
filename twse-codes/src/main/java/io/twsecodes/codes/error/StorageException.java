package io.twsecodes.codes.error;

/**
 * Persisted store or cache file could not be read or written.
 */
public class StorageException extends CodesException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
