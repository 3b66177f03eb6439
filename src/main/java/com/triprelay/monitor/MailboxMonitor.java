package com.triprelay.monitor;

import com.triprelay.config.DaemonProperties;
import com.triprelay.domain.ConnectionState;
import com.triprelay.domain.ConnectionStatus;
import com.triprelay.domain.MonitorMode;
import com.triprelay.mail.Mailbox;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Long-running mailbox watch loop
 *
 * CONNECTING: connect with exponential backoff, then pick a mode from the
 * IDLE probe. EVENT_MODE: bounded IDLE waits, an unseen search after every
 * wake-up or timeout. POLL_MODE: unseen search every poll interval. Any
 * mailbox I/O error goes back to CONNECTING; repeated processing failures
 * degrade EVENT_MODE to POLL_MODE until the next reconnect.
 *
 * Runs on a single thread. Only {@link #shutdown()} and the state getters
 * are meant to be called from elsewhere.
 */
@Slf4j
public class MailboxMonitor {

    private final Mailbox mailbox;
    private final DaemonProperties.Monitor settings;
    private final BackoffPolicy backoffPolicy;
    private final Clock clock;

    private final ConnectionState connectionState = new ConnectionState();
    private final Deque<Instant> processingErrors = new ArrayDeque<>();
    private final CountDownLatch shutdownSignal = new CountDownLatch(1);

    private volatile MonitorMode mode = MonitorMode.CONNECTING;
    private boolean initialConnect = true;

    public MailboxMonitor(Mailbox mailbox, DaemonProperties.Monitor settings, Clock clock) {
        this(mailbox, settings, new BackoffPolicy(settings.getReconnectBaseDelayMs(),
                settings.getReconnectMaxDelayMs(), settings.getReconnectJitterMs()), clock);
    }

    MailboxMonitor(Mailbox mailbox, DaemonProperties.Monitor settings, BackoffPolicy backoffPolicy, Clock clock) {
        this.mailbox = mailbox;
        this.settings = settings;
        this.backoffPolicy = backoffPolicy;
        this.clock = clock;
    }

    /**
     * Run until {@link #shutdown()}.
     *
     * @throws MailboxUnavailableException if the mailbox stays unreachable after all reconnect attempts
     */
    public void start(NewMessageHandler handler) throws MailboxUnavailableException {
        log.info("Mailbox monitor starting (IDLE {}, poll interval {}ms)",
                settings.isIdleEnabled() ? "enabled" : "disabled", settings.getPollIntervalMs());
        try {
            while (!isShutdownRequested()) {
                switch (mode) {
                    case CONNECTING -> connect();
                    case EVENT_MODE -> runEventCycle(handler);
                    case POLL_MODE -> runPollCycle(handler);
                    default -> {
                        return;
                    }
                }
            }
        } finally {
            mode = MonitorMode.SHUTTING_DOWN;
            mailbox.close();
            updateState(state -> state.setStatus(ConnectionStatus.DISCONNECTED));
            log.info("Mailbox monitor stopped");
        }
    }

    /**
     * Request a stop; an in-progress IDLE wait is aborted, a message in progress is finished first
     */
    public void shutdown() {
        if (shutdownSignal.getCount() == 0) {
            return;
        }
        log.info("Mailbox monitor shutdown requested");
        shutdownSignal.countDown();
        mailbox.abortWait();
    }

    public boolean isShutdownRequested() {
        return shutdownSignal.getCount() == 0;
    }

    public MonitorMode getMode() {
        return mode;
    }

    /**
     * Copy of the current connection state
     */
    public synchronized ConnectionState getConnectionState() {
        ConnectionState copy = new ConnectionState();
        copy.setStatus(connectionState.getStatus());
        copy.setReconnectAttempts(connectionState.getReconnectAttempts());
        copy.setLastError(connectionState.getLastError());
        return copy;
    }

    private void connect() throws MailboxUnavailableException {
        int maxAttempts = settings.getMaxReconnectAttempts();
        while (!isShutdownRequested()) {
            int attempt = nextAttempt();
            if (attempt > maxAttempts) {
                String lastError = getConnectionState().getLastError();
                log.error("Giving up after {} connection attempts, last error: {}", maxAttempts, lastError);
                throw new MailboxUnavailableException(
                        "Mailbox unreachable after " + maxAttempts + " attempts: " + lastError);
            }

            if (!initialConnect || attempt > 1) {
                long delay = backoffPolicy.delayMs(initialConnect ? attempt - 2 : attempt - 1);
                log.info("Reconnecting in {}ms (attempt {}/{})", delay, attempt, maxAttempts);
                if (!sleep(delay)) {
                    return;
                }
            }

            try {
                mailbox.reconnect();
                updateState(ConnectionState::markConnected);
                initialConnect = false;
                selectMode();
                return;
            } catch (IOException e) {
                log.error("Connection attempt {}/{} failed: {}", attempt, maxAttempts, e.getMessage());
                updateState(state -> state.markDisconnected(e.getMessage()));
            }
        }
    }

    private void selectMode() {
        boolean push = false;
        if (settings.isIdleEnabled()) {
            try {
                push = mailbox.probePushSupport();
            } catch (IOException e) {
                log.warn("IDLE capability probe failed, falling back to polling: {}", e.getMessage());
            }
        }
        processingErrors.clear();
        if (push) {
            mode = MonitorMode.EVENT_MODE;
            log.info("Monitoring in IDLE mode (wait {}ms)", settings.getEffectiveIdleWaitMs());
        } else {
            mode = MonitorMode.POLL_MODE;
            log.info("Monitoring in polling mode (every {}ms)", settings.getPollIntervalMs());
        }
    }

    private void runEventCycle(NewMessageHandler handler) {
        boolean notified;
        try {
            notified = mailbox.waitForNotification(Duration.ofMillis(settings.getEffectiveIdleWaitMs()));
        } catch (IOException e) {
            handleConnectionFailure("IDLE", e);
            return;
        }
        if (isShutdownRequested()) {
            return;
        }
        if (notified) {
            log.info("IDLE notification received, checking for new messages");
        } else {
            log.debug("IDLE wait ended without notification, running periodic check");
        }
        checkAndDeliver(handler);
    }

    private void runPollCycle(NewMessageHandler handler) {
        Instant started = clock.instant();
        checkAndDeliver(handler);
        if (mode != MonitorMode.POLL_MODE || isShutdownRequested()) {
            return;
        }
        long elapsed = Duration.between(started, clock.instant()).toMillis();
        long remaining = settings.getPollIntervalMs() - elapsed;
        if (remaining > 0) {
            log.debug("Next check in {}ms", remaining);
            sleep(remaining);
        }
    }

    private void checkAndDeliver(NewMessageHandler handler) {
        Set<String> unseen;
        try {
            unseen = mailbox.searchUnseen();
        } catch (IOException e) {
            handleConnectionFailure("UNSEEN search", e);
            return;
        }
        if (!unseen.isEmpty()) {
            log.info("Found {} unseen message(s)", unseen.size());
        }

        BatchResult result;
        try {
            result = handler.onNewMessages(unseen);
        } catch (RuntimeException e) {
            log.error("Message handler failed", e);
            recordProcessingError(e.getMessage());
            return;
        }
        if (result.isFailure()) {
            recordProcessingError(result.transientFailures() + " transient failure(s) in batch");
        } else if (result.attempted() > 0) {
            processingErrors.clear();
        }
    }

    private void recordProcessingError(String reason) {
        Instant now = clock.instant();
        Instant cutoff = now.minusMillis(settings.getProcessingErrorWindowMs());
        processingErrors.addLast(now);
        while (!processingErrors.isEmpty() && processingErrors.peekFirst().isBefore(cutoff)) {
            processingErrors.removeFirst();
        }

        int errors = processingErrors.size();
        log.warn("Processing error {}/{}: {}", errors, settings.getMaxConsecutiveProcessingErrors(), reason);
        if (mode == MonitorMode.EVENT_MODE && errors >= settings.getMaxConsecutiveProcessingErrors()) {
            log.warn("Too many processing errors, falling back to polling until the next reconnect");
            mode = MonitorMode.POLL_MODE;
            updateState(state -> state.markDegraded("Processing errors: " + reason));
            processingErrors.clear();
        }
    }

    private void handleConnectionFailure(String operation, IOException e) {
        if (isShutdownRequested()) {
            log.debug("{} ended during shutdown: {}", operation, e.getMessage());
            return;
        }
        log.error("{} failed, reconnecting: {}", operation, e.getMessage());
        updateState(state -> {
            state.markDisconnected(e.getMessage());
            state.setReconnectAttempts(0);
        });
        mode = MonitorMode.CONNECTING;
    }

    private synchronized int nextAttempt() {
        return connectionState.nextReconnectAttempt();
    }

    private synchronized void updateState(Consumer<ConnectionState> update) {
        update.accept(connectionState);
    }

    /**
     * @return false if shutdown was requested while sleeping
     */
    private boolean sleep(long millis) {
        try {
            return !shutdownSignal.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown();
            return false;
        }
    }
}
