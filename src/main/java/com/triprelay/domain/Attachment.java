package com.triprelay.domain;

/**
 * Raw attachment of an inbound mail
 */
public record Attachment(String filename, String contentType, byte[] content) {

    public int size() {
        return content == null ? 0 : content.length;
    }
}
