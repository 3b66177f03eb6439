package com.triprelay.failure;

/**
 * How repeated unparseable reasoning output for the same message is treated
 */
public enum ParseFailurePolicy {
    /** Parse failures are ordinary transient failures */
    COUNT_TOWARD_BUDGET,
    /** A second consecutive parse failure poisons the message immediately */
    POISON_ON_REPEAT
}
