package com.triprelay.config;

import com.triprelay.failure.FailureTracker;
import com.triprelay.guard.ReplyRateLimiter;
import com.triprelay.mail.Mailbox;
import com.triprelay.monitor.MailboxMonitor;
import com.triprelay.pipeline.PipelineContext;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Daemon-wide state and the mailbox monitor
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class DaemonConfig {

    private final DaemonProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PipelineContext pipelineContext(Clock clock, MeterRegistry meterRegistry) {
        FailureTracker tracker = new FailureTracker(properties.getRetry().getMaxAttempts(),
                properties.getRetry().getParseFailurePolicy(), clock);
        ReplyRateLimiter limiter = new ReplyRateLimiter(properties.getGuard().getMaxRepliesPerWindow(),
                Duration.ofMillis(properties.getGuard().getWindowMs()), clock);

        Gauge.builder("triprelay.failures.tracked", tracker, FailureTracker::size)
                .description("Messages with a failure history awaiting retry")
                .register(meterRegistry);

        log.info("Retry budget {} attempts, reply limit {} per {}s",
                tracker.getMaxAttempts(), properties.getGuard().getMaxRepliesPerWindow(),
                properties.getGuard().getWindowMs() / 1000);
        return new PipelineContext(tracker, limiter);
    }

    @Bean
    public MailboxMonitor mailboxMonitor(Mailbox mailbox, Clock clock, MeterRegistry meterRegistry) {
        MailboxMonitor monitor = new MailboxMonitor(mailbox, properties.getMonitor(), clock);
        Gauge.builder("triprelay.monitor.mode", monitor, m -> m.getMode().ordinal())
                .description("0=connecting, 1=idle, 2=polling, 3=shutting down")
                .register(meterRegistry);
        return monitor;
    }
}
