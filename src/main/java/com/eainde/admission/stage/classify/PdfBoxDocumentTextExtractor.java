package com.eainde.admission.stage.classify;

import com.eainde.admission.model.DocumentDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Extracts text from PDFs with PDFBox and decodes {@code text/*} uploads as UTF-8.
 * Images and other binary formats yield no text; OCR is not attempted.
 */
@Slf4j
public class PdfBoxDocumentTextExtractor implements DocumentTextExtractor {

    private final int maxPages;

    public PdfBoxDocumentTextExtractor(int maxPages) {
        this.maxPages = maxPages;
    }

    public PdfBoxDocumentTextExtractor() {
        this(Integer.MAX_VALUE);
    }

    @Override
    public String extractText(DocumentDescriptor descriptor, byte[] content) {
        if (content == null || content.length == 0) {
            return "";
        }
        if (isPdf(descriptor, content)) {
            return extractPdf(descriptor, content);
        }
        String type = descriptor.contentType() == null ? "" : descriptor.contentType().toLowerCase(Locale.ROOT);
        if (type.startsWith("text/")) {
            return new String(content, StandardCharsets.UTF_8);
        }
        log.debug("No text extraction for {} ({})", descriptor.filename(), descriptor.contentType());
        return "";
    }

    public static boolean isPdf(DocumentDescriptor descriptor, byte[] content) {
        if ("application/pdf".equalsIgnoreCase(descriptor.contentType())) {
            return true;
        }
        if (descriptor.filename() != null && descriptor.filename().toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            return true;
        }
        return hasPdfMagic(content);
    }

    public static boolean hasPdfMagic(byte[] content) {
        return content != null && content.length >= 4
                && content[0] == '%' && content[1] == 'P' && content[2] == 'D' && content[3] == 'F';
    }

    private String extractPdf(DocumentDescriptor descriptor, byte[] content) {
        try (PDDocument document = Loader.loadPDF(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(1);
            stripper.setEndPage(Math.min(maxPages, document.getNumberOfPages()));
            return stripper.getText(document);
        } catch (IOException e) {
            // Unreadable PDFs still get classified from their filename.
            log.warn("PDF text extraction failed for {}: {}", descriptor.filename(), e.getMessage());
            return "";
        }
    }
}
