package com.triprelay.mail;

import com.triprelay.config.DaemonProperties;
import com.triprelay.domain.InboundMessage;
import com.triprelay.util.EmlParser;
import jakarta.annotation.PreDestroy;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.event.MessageCountAdapter;
import jakarta.mail.event.MessageCountEvent;
import jakarta.mail.event.MessageCountListener;
import jakarta.mail.search.FlagTerm;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.angus.mail.imap.IMAPFolder;
import org.eclipse.angus.mail.imap.IMAPStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Jakarta Mail IMAP mailbox
 * - One store + folder connection, opened READ_WRITE
 * - UIDs as message ids
 * - IMAP IDLE with a bounded wait (RFC 2177)
 * - Bodies fetched with BODY.PEEK so fetching never sets \Seen
 */
@Slf4j
@Component
public class ImapMailbox implements Mailbox {

    private static final long ABORT_RETRY_MS = 1000L;

    private final DaemonProperties.Imap settings;
    private final Session session;
    private final String protocol;
    private final ScheduledExecutorService idleTimer;
    private final AtomicBoolean abortRequested = new AtomicBoolean(false);

    private volatile IMAPStore store;
    private volatile IMAPFolder folder;
    private volatile boolean idling = false;

    @Autowired
    public ImapMailbox(DaemonProperties properties) {
        this(properties.getImap(), Session.getInstance(sessionProperties(properties.getImap())));
    }

    ImapMailbox(DaemonProperties.Imap settings, Session session) {
        this.settings = settings;
        this.session = session;
        this.protocol = settings.isSsl() ? "imaps" : "imap";
        this.idleTimer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "imap-idle-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    static Properties sessionProperties(DaemonProperties.Imap imap) {
        String prefix = "mail." + (imap.isSsl() ? "imaps" : "imap") + ".";
        Properties props = new Properties();
        props.put("mail.store.protocol", imap.isSsl() ? "imaps" : "imap");
        props.put(prefix + "connectiontimeout", String.valueOf(imap.getConnectionTimeoutMs()));
        props.put(prefix + "timeout", String.valueOf(imap.getReadTimeoutMs()));
        props.put(prefix + "writetimeout", String.valueOf(imap.getReadTimeoutMs()));
        props.put(prefix + "peek", "true");
        props.put("mail.mime.address.strict", "false");
        return props;
    }

    @Override
    public void reconnect() throws IOException {
        close();
        try {
            Store newStore = session.getStore(protocol);
            newStore.connect(settings.getHost(), settings.getPort(), settings.getUsername(), settings.getPassword());
            Folder newFolder = newStore.getFolder(settings.getFolder());
            newFolder.open(Folder.READ_WRITE);
            attach((IMAPStore) newStore, (IMAPFolder) newFolder);
            log.info("Connected to {}://{}:{}/{}", protocol, settings.getHost(), settings.getPort(), settings.getFolder());
        } catch (MessagingException e) {
            throw new MailboxException("Connection to " + settings.getHost() + " failed: " + e.getMessage(), e);
        }
    }

    void attach(IMAPStore store, IMAPFolder folder) {
        this.store = store;
        this.folder = folder;
    }

    @Override
    public boolean probePushSupport() throws IOException {
        IMAPStore current = store;
        if (current == null) {
            throw new MailboxException("Not connected");
        }
        try {
            boolean supported = current.hasCapability("IDLE");
            log.info("IDLE support: {}", supported ? "yes" : "no");
            return supported;
        } catch (MessagingException e) {
            throw new MailboxException("Capability probe failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Set<String> searchUnseen() throws IOException {
        IMAPFolder current = requireFolder();
        try {
            Message[] unseen = current.search(new FlagTerm(new Flags(Flags.Flag.SEEN), false));
            FetchProfile profile = new FetchProfile();
            profile.add(UIDFolder.FetchProfileItem.UID);
            current.fetch(unseen, profile);

            TreeSet<Long> uids = new TreeSet<>();
            for (Message message : unseen) {
                uids.add(current.getUID(message));
            }
            Set<String> ids = new LinkedHashSet<>();
            for (Long uid : uids) {
                ids.add(String.valueOf(uid));
            }
            return ids;
        } catch (MessagingException e) {
            throw new MailboxException("UNSEEN search failed: " + e.getMessage(), e);
        }
    }

    @Override
    public InboundMessage fetch(String id) throws IOException {
        IMAPFolder current = requireFolder();
        byte[] raw;
        try {
            Message message = current.getMessageByUID(parseUid(id));
            if (message == null) {
                throw new MailboxException("Message UID " + id + " no longer exists");
            }
            raw = EmlParser.toBytes(message);
        } catch (MessagingException e) {
            throw new MailboxException("Fetch of UID " + id + " failed: " + e.getMessage(), e);
        }

        try {
            return EmlParser.toInboundMessage(id, raw);
        } catch (MessagingException | IOException | RuntimeException e) {
            throw new MalformedMessageException("UID " + id + " cannot be decoded: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean waitForNotification(Duration timeout) throws IOException {
        IMAPFolder current = requireFolder();
        AtomicBoolean announced = new AtomicBoolean(false);
        MessageCountListener listener = new MessageCountAdapter() {
            @Override
            public void messagesAdded(MessageCountEvent event) {
                announced.set(true);
            }
        };

        ScheduledFuture<?> timer = null;
        ScheduledFuture<?> abortWatch = null;
        current.addMessageCountListener(listener);
        try {
            int before = current.getMessageCount();
            // Raised before the flag is read so a racing abortWait() is seen here or by the watch
            idling = true;
            if (abortRequested.get()) {
                return false;
            }
            // Both keep interrupting until the wait returns, an interrupt sent before IDLE is issued has no effect
            timer = idleTimer.scheduleWithFixedDelay(this::interruptIdle,
                    timeout.toMillis(), ABORT_RETRY_MS, TimeUnit.MILLISECONDS);
            abortWatch = idleTimer.scheduleWithFixedDelay(() -> {
                if (abortRequested.get()) {
                    interruptIdle();
                }
            }, ABORT_RETRY_MS, ABORT_RETRY_MS, TimeUnit.MILLISECONDS);
            current.idle(true);
            idling = false;
            return announced.get() || current.getMessageCount() > before;
        } catch (MessagingException e) {
            throw new MailboxException("IDLE failed: " + e.getMessage(), e);
        } finally {
            idling = false;
            abortRequested.set(false);
            if (timer != null) {
                timer.cancel(false);
            }
            if (abortWatch != null) {
                abortWatch.cancel(false);
            }
            current.removeMessageCountListener(listener);
        }
    }

    /**
     * Ends a running or about-to-start IDLE wait; the wait returns within {@code ABORT_RETRY_MS}
     */
    @Override
    public void abortWait() {
        abortRequested.set(true);
        interruptIdle();
    }

    private void interruptIdle() {
        IMAPFolder current = folder;
        if (!idling || current == null) {
            return;
        }
        try {
            // Any folder command from another thread ends the IDLE with DONE
            current.getMessageCount();
        } catch (MessagingException e) {
            log.debug("IDLE abort failed: {}", e.getMessage());
        }
    }

    @Override
    public void markHandled(String id) throws IOException {
        IMAPFolder current = requireFolder();
        try {
            Message message = current.getMessageByUID(parseUid(id));
            if (message == null) {
                log.debug("UID {} no longer exists, nothing to mark", id);
                return;
            }
            if (message.isSet(Flags.Flag.SEEN)) {
                log.debug("UID {} already marked as seen", id);
                return;
            }
            message.setFlag(Flags.Flag.SEEN, true);
            log.info("Marked UID {} as seen", id);
        } catch (MessagingException e) {
            throw new MailboxException("Flag update for UID " + id + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isConnected() {
        IMAPStore currentStore = store;
        IMAPFolder currentFolder = folder;
        return currentStore != null && currentStore.isConnected()
                && currentFolder != null && currentFolder.isOpen();
    }

    @Override
    public void close() {
        IMAPFolder currentFolder = folder;
        IMAPStore currentStore = store;
        folder = null;
        store = null;
        if (currentFolder != null && currentFolder.isOpen()) {
            try {
                currentFolder.close(false);
            } catch (MessagingException e) {
                log.debug("Folder close failed: {}", e.getMessage());
            }
        }
        if (currentStore != null) {
            try {
                currentStore.close();
            } catch (MessagingException e) {
                log.debug("Store close failed: {}", e.getMessage());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing IMAP connection...");
        abortWait();
        close();
        idleTimer.shutdownNow();
    }

    private IMAPFolder requireFolder() throws MailboxException {
        IMAPFolder current = folder;
        if (current == null || !current.isOpen()) {
            throw new MailboxException("Mailbox folder is not open");
        }
        return current;
    }

    private static long parseUid(String id) throws MailboxException {
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            throw new MailboxException("Not an IMAP UID: " + id, e);
        }
    }
}
