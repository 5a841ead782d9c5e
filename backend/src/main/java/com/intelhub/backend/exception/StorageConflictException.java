package com.intelhub.backend.exception;

import java.util.UUID;
import lombok.Getter;

/**
 * A guarded transition found the item in a state or lease it did not expect. Indicates a broken
 * at-most-one-claim guarantee; never retried.
 */
@Getter
public class StorageConflictException extends RuntimeException {

    private final UUID uuid;

    public StorageConflictException(UUID uuid, String message) {
        super(message);
        this.uuid = uuid;
    }

    public StorageConflictException(UUID uuid, String message, Throwable cause) {
        super(message, cause);
        this.uuid = uuid;
    }
}
