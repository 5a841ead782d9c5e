package com.intelhub.backend.ingestion;

public enum RegistrationResult {
    CREATED,
    DUPLICATE
}
