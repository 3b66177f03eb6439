package com.triprelay.util;

import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Mail address helpers
 */
@Slf4j
public final class AddressUtil {

    private AddressUtil() {}

    /**
     * Strip angle brackets: {@code <user@host>} -> {@code user@host}
     */
    public static String stripAngleBrackets(String address) {
        if (address == null) return null;
        String stripped = address.trim();
        if (stripped.startsWith("<")) stripped = stripped.substring(1);
        if (stripped.endsWith(">")) stripped = stripped.substring(0, stripped.length() - 1);
        return stripped.trim();
    }

    /**
     * Extract the bare address from a header value that may carry a display name.
     * Returns an empty string for null or blank input.
     */
    public static String extractAddress(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return "";
        }
        try {
            InternetAddress[] parsed = InternetAddress.parseHeader(headerValue, false);
            if (parsed.length > 0 && parsed[0].getAddress() != null) {
                return parsed[0].getAddress().trim();
            }
        } catch (AddressException e) {
            log.debug("Unparseable address '{}': {}", headerValue, e.getMessage());
        }
        String value = headerValue.trim();
        int open = value.lastIndexOf('<');
        int close = value.lastIndexOf('>');
        if (open >= 0 && close > open) {
            return value.substring(open + 1, close).trim();
        }
        return stripAngleBrackets(value);
    }

    /**
     * Normalized key for per-recipient bookkeeping: bare address, lower case
     */
    public static String normalize(String headerValue) {
        return extractAddress(headerValue).toLowerCase(Locale.ROOT);
    }

    /**
     * Local part of an address (before '@'), lower case
     */
    public static String localPart(String headerValue) {
        String address = normalize(headerValue);
        int at = address.indexOf('@');
        return at < 0 ? address : address.substring(0, at);
    }

    /**
     * Domain of an address (after '@'), lower case
     */
    public static String domain(String headerValue) {
        String address = normalize(headerValue);
        int at = address.lastIndexOf('@');
        return at < 0 ? "" : address.substring(at + 1);
    }
}
