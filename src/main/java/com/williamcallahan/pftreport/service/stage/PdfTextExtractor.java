package com.williamcallahan.pftreport.service.stage;

import java.io.IOException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Extracts text content from uploaded PDF reports using Apache PDFBox.
 */
@Service
public class PdfTextExtractor {
    private static final Logger log = LoggerFactory.getLogger(PdfTextExtractor.class);

    /**
     * Extract text content from PDF bytes.
     *
     * @param pdfBytes raw PDF content
     * @return Extracted text content
     * @throws IOException if the PDF cannot be read
     */
    public String extractText(byte[] pdfBytes) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            PDFTextStripper stripper = new PDFTextStripper();

            // Keep table rows on one line so labelled values stay next to their labels
            stripper.setSortByPosition(true);
            stripper.setStartPage(1);
            stripper.setEndPage(document.getNumberOfPages());

            String text = stripper.getText(document);

            log.info("Extracted {} characters from {} PDF pages", text.length(), document.getNumberOfPages());

            return text;
        }
    }
}
