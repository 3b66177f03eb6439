package com.triprelay.mail;

/**
 * The message was retrieved but its MIME structure cannot be decoded.
 * Retrying cannot help.
 */
public class MalformedMessageException extends MailboxException {

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
