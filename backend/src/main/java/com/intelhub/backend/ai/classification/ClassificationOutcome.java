package com.intelhub.backend.ai.classification;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Either a valid result or a parse error. Malformed model output is an expected outcome, not an
 * exception.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class ClassificationOutcome {

    private final ClassificationResult result;
    private final String error;

    public static ClassificationOutcome valid(ClassificationResult result) {
        return new ClassificationOutcome(result, null);
    }

    public static ClassificationOutcome parseError(String error) {
        return new ClassificationOutcome(null, error);
    }

    public boolean isValid() {
        return result != null;
    }
}
