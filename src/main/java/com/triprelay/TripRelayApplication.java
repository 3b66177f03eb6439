package com.triprelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * TripRelay mailbox daemon
 *
 * Watches an IMAP inbox and answers itinerary mails with a calendar reply
 * - IMAP IDLE with polling fallback and reconnect
 * - Bounded retry with poison-message quarantine
 * - Auto-reply / bounce loop prevention
 * - Reasoning service via WebClient
 * - Prometheus metrics monitoring
 */
@SpringBootApplication
@EnableConfigurationProperties
public class TripRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(TripRelayApplication.class, args);
    }
}
