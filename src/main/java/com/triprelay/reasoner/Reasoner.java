package com.triprelay.reasoner;

/**
 * External reasoning service
 */
public interface Reasoner {

    /**
     * Complete a prompt
     *
     * @return raw response text
     * @throws ReasonerException on timeout, transport failure or rejection
     */
    String complete(String prompt);
}
