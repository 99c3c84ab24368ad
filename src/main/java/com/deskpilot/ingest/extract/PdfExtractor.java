package com.deskpilot.ingest.extract;

import com.deskpilot.model.ExtractedUnit;
import com.deskpilot.model.SourceDocument;
import com.deskpilot.util.LogSanitizer;
import com.deskpilot.util.TextNormalizer;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Text-layer PDF extraction, one unit per non-blank page. Image-only (scanned) PDFs yield
 * no units and are reported as not indexable by the caller.
 */
@Component
public class PdfExtractor implements DocumentExtractor {
    private static final Logger log = LoggerFactory.getLogger(PdfExtractor.class);

    @Override
    public FormatFamily family() {
        return FormatFamily.DOCUMENT;
    }

    @Override
    public Set<String> formats() {
        return Set.of("pdf");
    }

    @Override
    public List<ExtractedUnit> extract(SourceDocument document) {
        ArrayList<ExtractedUnit> units = new ArrayList<>();
        try (PDDocument pdf = Loader.loadPDF(document.payload())) {
            int pageCount = pdf.getNumberOfPages();
            PDFTextStripper stripper = new PDFTextStripper();
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String text = TextNormalizer.clean(stripper.getText(pdf));
                if (text.isBlank()) {
                    continue;
                }
                units.add(new ExtractedUnit(document.id(), text, "page:" + page, 1.0,
                        Map.of("page_number", page, "page_count", pageCount)));
            }
            if (units.isEmpty() && pageCount > 0) {
                log.warn("PDF {} has {} page(s) but no text layer; likely scanned", LogSanitizer.sanitize(document.filename()), pageCount);
            }
        }
        catch (IOException e) {
            throw new ExtractionException("Error processing PDF file " + document.filename() + ": " + e.getMessage(), e);
        }
        return units;
    }
}
