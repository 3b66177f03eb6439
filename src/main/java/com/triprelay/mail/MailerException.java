package com.triprelay.mail;

import java.io.IOException;

/**
 * Outbound send failed (connect, auth, timeout or rejected recipient)
 */
public class MailerException extends IOException {

    public MailerException(String message, Throwable cause) {
        super(message, cause);
    }
}
