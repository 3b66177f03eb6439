package com.triprelay.mail;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * AttachmentTextExtractor unit tests
 */
class AttachmentTextExtractorTest {

    private final AttachmentTextExtractor extractor = new AttachmentTextExtractor();

    private static byte[] pdf(String text) throws Exception {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(PDType1Font.HELVETICA, 12);
                content.newLineAtOffset(72, 700);
                content.showText(text);
                content.endText();
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }

    @Test
    @DisplayName("PDF text is extracted with PDFBox")
    void testExtract_Pdf() throws Exception {
        String text = extractor.extract(pdf("Confirmation AA100 XYZ123"));

        assertThat(text).contains("Confirmation AA100 XYZ123");
    }

    @Test
    @DisplayName("Plain text is decoded as UTF-8")
    void testExtract_Text() {
        String text = extractor.extract("  Hotel Zürich, check-in 15:00\n".getBytes(StandardCharsets.UTF_8));

        assertThat(text).isEqualTo("Hotel Zürich, check-in 15:00");
    }

    @Test
    @DisplayName("Binary, corrupt PDF and empty input yield an empty string")
    void testExtract_Unreadable() {
        assertThat(extractor.extract(new byte[]{(byte) 0x89, 'P', 'N', 'G', 0, 0, 0, 13})).isEmpty();
        assertThat(extractor.extract("%PDF-1.7 truncated".getBytes(StandardCharsets.US_ASCII))).isEmpty();
        assertThat(extractor.extract(new byte[0])).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }
}
