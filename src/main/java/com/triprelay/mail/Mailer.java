package com.triprelay.mail;

import java.io.IOException;

/**
 * Outbound mail transmission
 */
public interface Mailer {

    /**
     * Send one reply
     *
     * @param attachment optional calendar attachment, may be null
     */
    void send(String to, String subject, String body, ReplyAttachment attachment) throws IOException;
}
