package com.triprelay.mail;

import com.triprelay.config.DaemonProperties;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.search.SearchTerm;
import org.eclipse.angus.mail.imap.IMAPFolder;
import org.eclipse.angus.mail.imap.IMAPStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ImapMailbox unit tests with a mocked IMAP folder
 */
@ExtendWith(MockitoExtension.class)
class ImapMailboxTest {

    @Mock
    private IMAPStore store;

    @Mock
    private IMAPFolder folder;

    @Mock
    private Message message;

    private ImapMailbox mailbox;

    @BeforeEach
    void setUp() {
        mailbox = new ImapMailbox(new DaemonProperties.Imap(), Session.getInstance(new Properties()));
        mailbox.attach(store, folder);
        lenient().when(folder.isOpen()).thenReturn(true);
    }

    @AfterEach
    void tearDown() {
        mailbox.shutdown();
    }

    @Test
    @DisplayName("markHandled sets \\Seen once; the second call is a no-op")
    void testMarkHandled_Idempotent() throws Exception {
        when(folder.getMessageByUID(42L)).thenReturn(message);
        when(message.isSet(Flags.Flag.SEEN)).thenReturn(false, true);

        mailbox.markHandled("42");
        mailbox.markHandled("42");

        verify(message, times(1)).setFlag(Flags.Flag.SEEN, true);
    }

    @Test
    @DisplayName("markHandled on an expunged message does nothing")
    void testMarkHandled_Expunged() throws Exception {
        when(folder.getMessageByUID(42L)).thenReturn(null);

        mailbox.markHandled("42");

        verify(message, never()).setFlag(any(Flags.Flag.class), anyBoolean());
    }

    @Test
    @DisplayName("Unseen search returns UIDs in ascending order")
    void testSearchUnseen_Ordered() throws Exception {
        Message first = mock(Message.class);
        Message second = mock(Message.class);
        when(folder.search(any(SearchTerm.class))).thenReturn(new Message[]{first, second});
        when(folder.getUID(first)).thenReturn(9L);
        when(folder.getUID(second)).thenReturn(3L);

        assertThat(mailbox.searchUnseen()).containsExactly("3", "9");
        verify(folder).fetch(any(Message[].class), any(FetchProfile.class));
    }

    @Test
    @DisplayName("Server error during fetch is a transient mailbox failure, not a malformed message")
    void testFetch_ServerError() throws Exception {
        when(folder.getMessageByUID(42L)).thenThrow(new MessagingException("BYE"));

        assertThatThrownBy(() -> mailbox.fetch("42"))
                .isInstanceOf(MailboxException.class)
                .isNotInstanceOf(MalformedMessageException.class);
    }

    @Test
    @DisplayName("Non-numeric id is rejected")
    void testFetch_InvalidUid() {
        assertThatThrownBy(() -> mailbox.fetch("abc")).isInstanceOf(MailboxException.class);
    }

    @Test
    @DisplayName("Closed folder is reported as a mailbox failure")
    void testSearchUnseen_NotConnected() {
        when(folder.isOpen()).thenReturn(false);

        assertThatThrownBy(() -> mailbox.searchUnseen()).isInstanceOf(MailboxException.class);
    }

    @Test
    @DisplayName("IDLE capability probe")
    void testProbePushSupport() throws Exception {
        when(store.hasCapability("IDLE")).thenReturn(true);

        assertThat(mailbox.probePushSupport()).isTrue();
    }

    @Test
    @DisplayName("abortWait before the wait starts: returns at once without issuing IDLE")
    void testWaitForNotification_AbortedBeforeStart() throws Exception {
        when(folder.getMessageCount()).thenReturn(5);

        mailbox.abortWait();

        assertThat(mailbox.waitForNotification(Duration.ofMinutes(5))).isFalse();
        verify(folder, never()).idle(anyBoolean());
    }

    @Test
    @DisplayName("abortWait whose first interrupt misses the IDLE start still ends the wait well before the timeout")
    void testWaitForNotification_AbortRacingIdleStart() throws Exception {
        CountDownLatch idleEntered = new CountDownLatch(1);
        CountDownLatch idleEnded = new CountDownLatch(1);
        AtomicInteger countCalls = new AtomicInteger();
        // call 1: baseline count, call 2: the immediate interrupt, lost; call 3: the retried interrupt
        when(folder.getMessageCount()).thenAnswer(invocation -> {
            if (countCalls.incrementAndGet() >= 3) {
                idleEnded.countDown();
            }
            return 5;
        });
        doAnswer(invocation -> {
            idleEntered.countDown();
            idleEnded.await(10, TimeUnit.SECONDS);
            return null;
        }).when(folder).idle(true);

        AtomicReference<Boolean> notified = new AtomicReference<>();
        Thread waiter = new Thread(() -> {
            try {
                notified.set(mailbox.waitForNotification(Duration.ofMinutes(5)));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }, "idle-test");
        waiter.start();

        assertThat(idleEntered.await(5, TimeUnit.SECONDS)).isTrue();
        mailbox.abortWait();
        waiter.join(5000);

        assertThat(waiter.isAlive()).isFalse();
        assertThat(notified.get()).isFalse();
        assertThat(countCalls.get()).isGreaterThanOrEqualTo(3);
    }

    @Test
    @DisplayName("Session properties enable BODY.PEEK and timeouts for imaps")
    void testSessionProperties() {
        DaemonProperties.Imap imap = new DaemonProperties.Imap();
        imap.setReadTimeoutMs(4444L);

        Properties props = ImapMailbox.sessionProperties(imap);

        assertThat(props.getProperty("mail.imaps.peek")).isEqualTo("true");
        assertThat(props.getProperty("mail.imaps.timeout")).isEqualTo("4444");
        assertThat(props.getProperty("mail.store.protocol")).isEqualTo("imaps");
    }
}
