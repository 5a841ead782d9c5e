package com.intelhub.backend.exception;

import java.util.UUID;
import lombok.Getter;

@Getter
public class ItemNotFoundException extends RuntimeException {

    private final UUID uuid;

    public ItemNotFoundException(UUID uuid) {
        super("Intelligence item not found: " + uuid);
        this.uuid = uuid;
    }

    public ItemNotFoundException(UUID uuid, String message) {
        super(message);
        this.uuid = uuid;
    }
}
