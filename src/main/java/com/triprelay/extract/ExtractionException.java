package com.triprelay.extract;

import com.triprelay.failure.FailureCategory;
import com.triprelay.failure.FailureKind;

/**
 * Reasoning output could not be turned into a structured result.
 * Always transient: the same prompt may well produce parseable output next time.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public FailureKind getKind() {
        return FailureKind.TRANSIENT;
    }

    public FailureCategory getCategory() {
        return FailureCategory.PARSE;
    }
}
