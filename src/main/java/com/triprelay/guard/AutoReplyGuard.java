package com.triprelay.guard;

import com.triprelay.config.DaemonProperties;
import com.triprelay.domain.InboundMessage;
import com.triprelay.util.AddressUtil;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Auto-reply / bounce classification (RFC 3834 heuristics)
 * - Auto-Submitted, Precedence, empty Return-Path
 * - X-Auto-Response-Suppress and mailing-list headers
 * - Daemon/bounce senders and self-loop
 * - Out-of-office and delivery-failure subjects
 *
 * Stateless and cheap: runs on every message before any reasoning call.
 */
@Component
public class AutoReplyGuard {

    private static final Set<String> BULK_PRECEDENCE = Set.of("bulk", "junk", "list", "auto_reply");

    private static final List<String> BOUNCE_SENDERS = List.of(
            "mailer-daemon", "mail-daemon", "postmaster",
            "bounce", "returned", "undeliverable",
            "mail delivery", "delivery status");

    private static final List<String> AUTO_REPLY_SUBJECTS = List.of(
            "automatic reply",
            "auto-reply",
            "autoreply",
            "out of office",
            "out of the office",
            "away from",
            "on vacation",
            "delivery status notification",
            "delivery failure",
            "undeliverable",
            "returned mail",
            "mail delivery failed",
            "failure notice",
            "delayed mail",
            "could not be delivered",
            "read receipt",
            "read: ");

    private final String ownAddress;
    private final List<String> senderPatterns;
    private final List<String> subjectPatterns;

    @Autowired
    public AutoReplyGuard(DaemonProperties properties) {
        this(properties.getSmtp().getFromAddress(),
                properties.getGuard().getExtraSenderPatterns(),
                properties.getGuard().getExtraSubjectPatterns());
    }

    public AutoReplyGuard(String ownAddress, List<String> extraSenderPatterns, List<String> extraSubjectPatterns) {
        this.ownAddress = AddressUtil.normalize(ownAddress);
        this.senderPatterns = merge(BOUNCE_SENDERS, extraSenderPatterns);
        this.subjectPatterns = merge(AUTO_REPLY_SUBJECTS, extraSubjectPatterns);
    }

    /**
     * Decide whether a message must not receive an automated reply.
     * The first matching rule wins.
     */
    public SkipDecision classify(InboundMessage message) {
        String autoSubmitted = lower(message.header("Auto-Submitted"));
        if (!autoSubmitted.isEmpty() && !"no".equals(autoSubmitted)) {
            return SkipDecision.skip("Auto-Submitted header: " + autoSubmitted);
        }

        String precedence = lower(message.header("Precedence"));
        if (BULK_PRECEDENCE.contains(precedence)) {
            return SkipDecision.skip("Precedence header: " + precedence);
        }

        if (message.hasHeader("Return-Path") && isEmptyReturnPath(message.header("Return-Path"))) {
            return SkipDecision.skip("Empty Return-Path (bounce indicator)");
        }

        if (message.hasHeader("X-Auto-Response-Suppress")) {
            return SkipDecision.skip("X-Auto-Response-Suppress header present");
        }

        if (message.hasHeader("List-Id") || message.hasHeader("List-Unsubscribe")) {
            return SkipDecision.skip("Mailing list headers present");
        }

        String from = lower(message.getSender());
        for (String pattern : senderPatterns) {
            if (from.contains(pattern)) {
                return SkipDecision.skip("Bounce sender pattern: " + pattern);
            }
        }

        if (!ownAddress.isEmpty() && ownAddress.equals(AddressUtil.normalize(message.getSender()))) {
            return SkipDecision.skip("Self-loop detected (from own address)");
        }

        String subject = lower(message.getSubject());
        for (String pattern : subjectPatterns) {
            if (subject.contains(pattern)) {
                return SkipDecision.skip("Auto-reply subject pattern: " + pattern.trim());
            }
        }

        return SkipDecision.reply();
    }

    private static boolean isEmptyReturnPath(String returnPath) {
        String value = returnPath == null ? "" : returnPath.trim();
        return value.replace("<", "").replace(">", "").isBlank();
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).trim();
    }

    private static List<String> merge(List<String> defaults, List<String> extra) {
        List<String> merged = new ArrayList<>(defaults);
        if (extra != null) {
            for (String pattern : extra) {
                if (pattern != null && !pattern.isBlank()) {
                    merged.add(pattern.toLowerCase(Locale.ROOT));
                }
            }
        }
        return List.copyOf(merged);
    }
}
