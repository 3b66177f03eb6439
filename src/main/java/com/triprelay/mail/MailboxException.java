package com.triprelay.mail;

import java.io.IOException;

/**
 * I/O failure talking to the mailbox (connection reset, auth failure, protocol error)
 */
public class MailboxException extends IOException {

    public MailboxException(String message) {
        super(message);
    }

    public MailboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
