package com.eainde.admission.rag;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the source rulebook into pages: PDFs page by page through PDFBox, anything else
 * as UTF-8 text with form-feed separated pages.
 */
@Slf4j
public class RulebookLoader {

    private final RulebookChunker chunker;

    public RulebookLoader(RulebookChunker chunker) {
        this.chunker = chunker;
    }

    public List<RulebookPage> load(Path source) throws IOException {
        if (!Files.exists(source)) {
            throw new IOException("Rulebook not found at " + source);
        }
        List<RulebookPage> pages = source.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf")
                ? loadPdf(source)
                : chunker.splitPages(Files.readString(source, StandardCharsets.UTF_8));
        log.info("Loaded {} pages from rulebook {}", pages.size(), source);
        return pages;
    }

    private List<RulebookPage> loadPdf(Path source) throws IOException {
        List<RulebookPage> pages = new ArrayList<>();
        try (PDDocument document = Loader.loadPDF(source.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            for (int page = 1; page <= document.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String text = stripper.getText(document);
                if (text != null && !text.isBlank()) {
                    pages.add(new RulebookPage(page, text.strip()));
                }
            }
        }
        return pages;
    }
}
