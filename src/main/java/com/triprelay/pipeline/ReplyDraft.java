package com.triprelay.pipeline;

import com.triprelay.mail.ReplyAttachment;

/**
 * Outgoing reply ready for the mailer; attachment may be null
 */
public record ReplyDraft(String subject, String body, ReplyAttachment attachment) {

    public boolean hasAttachment() {
        return attachment != null;
    }
}
