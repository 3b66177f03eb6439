package com.triprelay.failure;

/**
 * Pipeline step a failure originated from
 */
public enum FailureCategory {
    FETCH,
    INPUT,
    REASONER,
    PARSE,
    SEND,
    /** Unexpected runtime error inside the pipeline */
    INTERNAL
}
