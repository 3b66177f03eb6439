package com.triprelay.mail;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Attachment text extraction
 * - PDF via Apache PDFBox
 * - Plain text decoded as UTF-8
 * - Anything else (images, archives, corrupt files) yields ""
 */
@Slf4j
@Component
public class AttachmentTextExtractor implements DocumentExtractor {

    private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);
    private static final int TEXT_PROBE_LENGTH = 1024;

    @Override
    public String extract(byte[] content) {
        if (content == null || content.length == 0) {
            return "";
        }
        if (startsWith(content, PDF_MAGIC)) {
            return extractPdf(content);
        }
        if (looksLikeText(content)) {
            return new String(content, StandardCharsets.UTF_8).strip();
        }
        log.debug("Unsupported attachment format ({} bytes), no text extracted", content.length);
        return "";
    }

    private String extractPdf(byte[] content) {
        try (PDDocument document = PDDocument.load(content)) {
            String text = new PDFTextStripper().getText(document);
            log.debug("Extracted {} chars from {} PDF page(s)", text.length(), document.getNumberOfPages());
            return text.strip();
        } catch (IOException | RuntimeException e) {
            log.warn("PDF text extraction failed: {}", e.getMessage());
            return "";
        }
    }

    private static boolean looksLikeText(byte[] content) {
        int limit = Math.min(content.length, TEXT_PROBE_LENGTH);
        for (int i = 0; i < limit; i++) {
            if (content[i] == 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean startsWith(byte[] content, byte[] prefix) {
        if (content.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (content[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
