package com.triprelay.config;

import com.triprelay.failure.ParseFailurePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * TripRelay daemon configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "triprelay")
public class DaemonProperties {

    private Imap imap = new Imap();
    private Smtp smtp = new Smtp();
    private Reasoner reasoner = new Reasoner();
    private Monitor monitor = new Monitor();
    private Retry retry = new Retry();
    private Guard guard = new Guard();
    private Reply reply = new Reply();

    @Data
    public static class Imap {
        private String host = "localhost";
        private int port = 993;
        private boolean ssl = true;
        private String username;
        private String password;
        private String folder = "INBOX";
        private long connectionTimeoutMs = 10000L;
        private long readTimeoutMs = 60000L;
    }

    @Data
    public static class Smtp {
        private String host = "localhost";
        private int port = 587;
        private boolean startTls = true;
        private String username;
        private String password;
        /** Outbound From address, also used for self-loop detection */
        private String fromAddress;
        private long connectionTimeoutMs = 10000L;
        private long timeoutMs = 30000L;
        private long writeTimeoutMs = 20000L;
    }

    @Data
    public static class Reasoner {
        private String endpoint;
        private String apiKey;
        private double temperature = 0.0;
        private int maxTokens = 8000;
        private long connectTimeoutMs = 10000L;
        private long readTimeoutMs = 120000L;
        /** In-call retries on transient errors, on top of the first attempt */
        private int maxRetries = 2;
        private long retryBaseDelayMs = 2000L;
        /**
         * Bound of one complete() call across all attempts and backoff.
         * Without it the worst case is (maxRetries + 1) * (connect + read) plus backoff.
         */
        private long totalTimeoutMs = 300000L;
        private int maxResponseBytes = 4 * 1024 * 1024;
    }

    @Data
    public static class Monitor {
        private boolean enabled = true;
        private boolean idleEnabled = true;
        /** Server-side IDLE expiry (RFC 2177 allows 29 minutes) */
        private long idleTimeoutMs = 1740000L;
        private long idleSafetyMarginMs = 60000L;
        /** Upper bound of one IDLE wait; a periodic check runs after each timeout */
        private long idleCheckIntervalMs = 300000L;
        private long pollIntervalMs = 30000L;
        private int maxReconnectAttempts = 5;
        private long reconnectBaseDelayMs = 5000L;
        private long reconnectMaxDelayMs = 300000L;
        private long reconnectJitterMs = 1000L;
        private int maxConsecutiveProcessingErrors = 3;
        private long processingErrorWindowMs = 600000L;

        /**
         * Length of one IDLE wait: reissued before the server expiry with a margin
         */
        public long getEffectiveIdleWaitMs() {
            long beforeExpiry = idleTimeoutMs - idleSafetyMarginMs;
            if (beforeExpiry <= 0) {
                beforeExpiry = idleTimeoutMs / 2;
            }
            return Math.max(1L, Math.min(beforeExpiry, idleCheckIntervalMs));
        }
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private ParseFailurePolicy parseFailurePolicy = ParseFailurePolicy.COUNT_TOWARD_BUDGET;
    }

    @Data
    public static class Guard {
        private int maxRepliesPerWindow = 3;
        private long windowMs = 3600000L;
        private List<String> extraSenderPatterns = new ArrayList<>();
        private List<String> extraSubjectPatterns = new ArrayList<>();
    }

    @Data
    public static class Reply {
        /** Used when the sender is a do-not-reply address and no forwarder is found */
        private String defaultReplyTo;
        private List<String> noReplyIndicators = new ArrayList<>(List.of(
                "noreply", "no-reply", "do-not-reply", "donotreply",
                "auto-confirm", "automated", "system", "notification"));
        private List<String> systemSenderDomains = new ArrayList<>(List.of(
                "aa.com", "delta.com", "united.com", "southwest.com", "jetblue.com",
                "expedia.com", "travelocity.com"));
        private String signature = "TripRelay Itinerary Processing";
    }
}
