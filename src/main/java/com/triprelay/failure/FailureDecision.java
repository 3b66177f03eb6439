package com.triprelay.failure;

public enum FailureDecision {
    /** Leave the message unacknowledged; it is offered again next cycle */
    RETRY,
    /** Send the fallback notice, acknowledge and forget the message */
    POISON
}
