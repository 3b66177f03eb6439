package com.triprelay.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A fetched inbound mail.
 * Immutable; attachment texts are added through {@link #withAttachmentTexts(List)}.
 */
@Value
@Builder(toBuilder = true)
public class InboundMessage {

    /** IMAP UID, stable within one mailbox session */
    String id;
    String subject;
    /** From header as received, may include a display name */
    String sender;
    String recipient;
    String messageIdHeader;
    /** Header name -> values in arrival order */
    @Singular
    Map<String, List<String>> headers;
    String bodyText;
    @Singular
    List<Attachment> attachments;
    @Singular
    List<String> attachmentTexts;

    /**
     * First value of a header, matched case-insensitively
     */
    public String header(String name) {
        List<String> values = headerValues(name);
        return values.isEmpty() ? null : values.get(0);
    }

    /**
     * All values of a header, matched case-insensitively
     */
    public List<String> headerValues(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return List.of();
    }

    public boolean hasHeader(String name) {
        return !headerValues(name).isEmpty();
    }

    public InboundMessage withAttachmentTexts(List<String> texts) {
        return toBuilder().clearAttachmentTexts().attachmentTexts(texts).build();
    }
}
