package com.alterante.relay.storage;

/**
 * Local storage could not create, write, move or delete a file.
 * Never retried: the same call against the same disk fails the same way.
 */
public class StorageException extends Exception {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
