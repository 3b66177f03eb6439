package com.triprelay.mail;

/**
 * Attachment of an outgoing reply
 */
public record ReplyAttachment(String filename, String contentType, String content) {

    public static ReplyAttachment calendar(String filename, String icsContent) {
        return new ReplyAttachment(filename, "text/calendar; charset=UTF-8; method=PUBLISH", icsContent);
    }
}
