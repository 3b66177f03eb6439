package com.triprelay.util;

import com.triprelay.domain.Attachment;
import com.triprelay.domain.InboundMessage;
import jakarta.mail.Address;
import jakarta.mail.Header;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeUtility;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * EML parsing utilities based on Jakarta Mail
 */
@Slf4j
public final class EmlParser {

    private static final Session SESSION;

    static {
        Properties props = new Properties();
        props.setProperty("mail.mime.charset", "UTF-8");
        props.setProperty("mail.mime.decodetext.strict", "false");
        props.setProperty("mail.mime.address.strict", "false");
        SESSION = Session.getInstance(props);
    }

    private EmlParser() {}

    /**
     * Parse a MimeMessage from bytes
     */
    public static MimeMessage parse(byte[] emlData) throws MessagingException, IOException {
        try (InputStream is = new ByteArrayInputStream(emlData)) {
            return new MimeMessage(SESSION, is);
        }
    }

    /**
     * Serialize a message to bytes
     */
    public static byte[] toBytes(Message message) throws MessagingException, IOException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        message.writeTo(outputStream);
        return outputStream.toByteArray();
    }

    /**
     * Decode raw EML bytes into an {@link InboundMessage}
     */
    public static InboundMessage toInboundMessage(String id, byte[] emlData) throws MessagingException, IOException {
        return toInboundMessage(id, parse(emlData));
    }

    /**
     * Decode a parsed message into an {@link InboundMessage}
     * - Headers keep their first-seen spelling, repeated values are kept in order
     * - Body prefers text/plain, falls back to tag-stripped text/html
     * - Forwarded message/rfc822 parts are walked like inline content
     */
    public static InboundMessage toInboundMessage(String id, MimeMessage message) throws MessagingException, IOException {
        StringBuilder plain = new StringBuilder();
        StringBuilder html = new StringBuilder();
        List<Attachment> attachments = new ArrayList<>();
        collect(message, plain, html, attachments);

        String body = plain.length() > 0 ? plain.toString() : stripHtml(html.toString());

        return InboundMessage.builder()
                .id(id)
                .subject(extractSubject(message))
                .sender(extractSender(message))
                .recipient(extractRecipient(message))
                .messageIdHeader(message.getMessageID())
                .headers(extractHeaders(message))
                .bodyText(body.strip())
                .attachments(attachments)
                .build();
    }

    /**
     * Extract Subject; empty string when absent
     */
    public static String extractSubject(MimeMessage message) throws MessagingException {
        String subject = message.getSubject();
        return subject != null ? subject : "";
    }

    /**
     * Extract sender, falling back to the raw header when the address does not parse
     */
    public static String extractSender(MimeMessage message) throws MessagingException {
        try {
            Address[] from = message.getFrom();
            if (from != null && from.length > 0) {
                return render(from[0]);
            }
        } catch (MessagingException e) {
            log.debug("Malformed From header: {}", e.getMessage());
        }
        String raw = message.getHeader("From", ",");
        return raw != null ? decode(raw) : "";
    }

    /**
     * Extract first To recipient, falling back to the raw header
     */
    public static String extractRecipient(MimeMessage message) throws MessagingException {
        try {
            Address[] to = message.getRecipients(Message.RecipientType.TO);
            if (to != null && to.length > 0) {
                return render(to[0]);
            }
        } catch (MessagingException e) {
            log.debug("Malformed To header: {}", e.getMessage());
        }
        String raw = message.getHeader("To", ",");
        return raw != null ? decode(raw) : "";
    }

    /**
     * All headers, case-insensitively grouped, unfolded and decoded
     */
    public static Map<String, List<String>> extractHeaders(MimeMessage message) throws MessagingException {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        Map<String, String> spelling = new HashMap<>();
        Enumeration<Header> all = message.getAllHeaders();
        while (all.hasMoreElements()) {
            Header header = all.nextElement();
            String key = spelling.computeIfAbsent(header.getName().toLowerCase(Locale.ROOT), k -> header.getName());
            headers.computeIfAbsent(key, k -> new ArrayList<>())
                    .add(decode(MimeUtility.unfold(header.getValue() == null ? "" : header.getValue())));
        }
        return headers;
    }

    private static void collect(Part part, StringBuilder plain, StringBuilder html, List<Attachment> attachments)
            throws MessagingException, IOException {
        String filename = part.getFileName();
        boolean attachment = Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition())
                || (filename != null && !part.isMimeType("multipart/*"));

        if (attachment) {
            attachments.add(new Attachment(filename, baseType(part.getContentType()), readAll(part)));
        } else if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                collect(multipart.getBodyPart(i), plain, html, attachments);
            }
        } else if (part.isMimeType("message/rfc822")) {
            Object nested = part.getContent();
            if (nested instanceof Part nestedPart) {
                collect(nestedPart, plain, html, attachments);
            }
        } else if (part.isMimeType("text/plain")) {
            appendSection(plain, textContent(part));
        } else if (part.isMimeType("text/html")) {
            appendSection(html, textContent(part));
        }
    }

    private static String textContent(Part part) throws MessagingException, IOException {
        try {
            Object content = part.getContent();
            if (content instanceof String text) {
                return text;
            }
        } catch (UnsupportedEncodingException e) {
            log.debug("Unknown charset, decoding as UTF-8: {}", e.getMessage());
        }
        return new String(readAll(part), StandardCharsets.UTF_8);
    }

    private static byte[] readAll(Part part) throws MessagingException, IOException {
        try (InputStream is = part.getInputStream()) {
            return is.readAllBytes();
        }
    }

    private static void appendSection(StringBuilder target, String text) {
        if (target.length() > 0) {
            target.append("\n\n");
        }
        target.append(text);
    }

    private static String stripHtml(String html) {
        if (html.isEmpty()) {
            return html;
        }
        return html.replaceAll("(?is)<(script|style)[^>]*>.*?</\\1>", " ")
                .replaceAll("(?i)<br\\s*/?>|</p>|</div>|</tr>", "\n")
                .replaceAll("<[^>]+>", " ")
                .replace("&nbsp;", " ")
                .replace("&amp;", "&")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replaceAll("[ \\t]+", " ");
    }

    private static String baseType(String contentType) {
        if (contentType == null) {
            return "application/octet-stream";
        }
        int semicolon = contentType.indexOf(';');
        return (semicolon < 0 ? contentType : contentType.substring(0, semicolon)).trim().toLowerCase(Locale.ROOT);
    }

    private static String render(Address address) {
        if (address instanceof InternetAddress internetAddress) {
            return internetAddress.toUnicodeString();
        }
        return address.toString();
    }

    private static String decode(String value) {
        try {
            return MimeUtility.decodeText(value);
        } catch (UnsupportedEncodingException e) {
            return value;
        }
    }
}
