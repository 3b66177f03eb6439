package com.triprelay.monitor;

import com.triprelay.pipeline.InboxProcessor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Starts the mailbox monitor in the background and stops it with the application.
 * An unreachable mailbox ends the process with exit code 1.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "triprelay.monitor", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MonitorRunner {

    static final int EXIT_MAILBOX_UNAVAILABLE = 1;

    private final MailboxMonitor monitor;
    private final InboxProcessor inboxProcessor;
    private final ApplicationContext applicationContext;

    @PostConstruct
    public void start() {
        Mono.fromRunnable(this::run)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe();
    }

    private void run() {
        log.info("=== TripRelay mailbox monitor started ===");
        try {
            monitor.start(inboxProcessor);
        } catch (MailboxUnavailableException e) {
            log.error("Mailbox unavailable, shutting down: {}", e.getMessage());
            int code = SpringApplication.exit(applicationContext, () -> EXIT_MAILBOX_UNAVAILABLE);
            System.exit(code);
        } catch (RuntimeException e) {
            log.error("Mailbox monitor crashed", e);
            int code = SpringApplication.exit(applicationContext, () -> EXIT_MAILBOX_UNAVAILABLE);
            System.exit(code);
        }
    }

    @PreDestroy
    public void stop() {
        log.info("Shutting down mailbox monitor...");
        inboxProcessor.stop();
        monitor.shutdown();
    }
}
