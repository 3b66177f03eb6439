package com.triprelay.reasoner;

import com.triprelay.failure.FailureKind;
import lombok.Getter;

/**
 * Reasoning call failed
 */
@Getter
public class ReasonerException extends RuntimeException {

    public enum Reason {
        /** Connect or read timeout */
        TIMEOUT,
        /** Connection failure, remote 5xx, throttling or auth trouble */
        TRANSPORT,
        /** Remote refused this particular request (4xx); resending the same prompt cannot help */
        REJECTED
    }

    private final Reason reason;
    private final int status;

    public ReasonerException(Reason reason, String message, Throwable cause) {
        this(reason, 0, message, cause);
    }

    public ReasonerException(Reason reason, int status, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.status = status;
    }

    public FailureKind getKind() {
        return reason == Reason.REJECTED ? FailureKind.PERMANENT : FailureKind.TRANSIENT;
    }
}
