package com.triprelay.mail;

/**
 * Text extraction from binary attachments.
 * Fails closed: returns an empty string for anything it cannot read, never throws.
 */
public interface DocumentExtractor {

    String extract(byte[] content);
}
