package com.triprelay.pipeline;

import com.triprelay.config.DaemonProperties;
import com.triprelay.domain.InboundMessage;
import com.triprelay.util.AddressUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reply-to policy
 * - Ordinary senders get the reply themselves
 * - Do-not-reply and system senders: the forwarder of a forwarded mail,
 *   else the configured default reply-to, else nobody
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReplyAddressResolver {

    private static final Pattern EMAIL = Pattern.compile("[\\w.+-]+@[\\w-]+(\\.[\\w-]+)+");
    private static final String[] FORWARD_MARKERS = {"fw:", "fwd:", "forwarded"};
    private static final int FORWARD_HEADER_LINES = 10;

    private final DaemonProperties properties;

    public Optional<String> resolve(InboundMessage message) {
        String address = AddressUtil.extractAddress(message.getSender());
        if (address.isEmpty()) {
            log.warn("No sender address on message {}", message.getId());
            return defaultReplyTo();
        }
        if (!isDoNotReply(address)) {
            return Optional.of(address);
        }

        if (isForwarded(message.getSubject())) {
            Optional<String> forwarder = findForwarder(message.getBodyText());
            if (forwarder.isPresent()) {
                log.info("Forwarded mail detected, replying to: {}", forwarder.get());
                return forwarder;
            }
        }

        Optional<String> fallback = defaultReplyTo();
        if (fallback.isPresent()) {
            log.info("Do-not-reply sender {}, using default: {}", address, fallback.get());
        } else {
            log.warn("Do-not-reply sender {}, no default reply-to configured", address);
        }
        return fallback;
    }

    boolean isDoNotReply(String address) {
        String localPart = AddressUtil.localPart(address);
        for (String indicator : properties.getReply().getNoReplyIndicators()) {
            if (localPart.contains(indicator.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        String domain = AddressUtil.domain(address);
        for (String systemDomain : properties.getReply().getSystemSenderDomains()) {
            String candidate = systemDomain.toLowerCase(Locale.ROOT);
            if (domain.equals(candidate) || domain.endsWith("." + candidate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isForwarded(String subject) {
        String lower = subject == null ? "" : subject.toLowerCase(Locale.ROOT);
        for (String marker : FORWARD_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static Optional<String> findForwarder(String body) {
        if (body == null || body.isEmpty()) {
            return Optional.empty();
        }
        String[] lines = body.split("\\r?\\n");
        for (int i = 0; i < Math.min(lines.length, FORWARD_HEADER_LINES); i++) {
            String line = lines[i];
            if (line.toLowerCase(Locale.ROOT).contains("from:")) {
                Matcher matcher = EMAIL.matcher(line);
                if (matcher.find()) {
                    return Optional.of(matcher.group());
                }
            }
        }
        return Optional.empty();
    }

    private Optional<String> defaultReplyTo() {
        String configured = properties.getReply().getDefaultReplyTo();
        return configured == null || configured.isBlank() ? Optional.empty() : Optional.of(configured.trim());
    }
}
