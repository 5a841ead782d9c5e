package com.intelhub.backend.ai.classification;

import com.intelhub.backend.exception.AiProviderException;

/**
 * Turns raw item text into a structured classification.
 */
public interface IntelligenceClassifier {

    /**
     * @return a valid result or a parse error for malformed output
     * @throws AiProviderException on transport, timeout or rate-limit failures
     */
    ClassificationOutcome classify(ClassificationRequest request);
}
