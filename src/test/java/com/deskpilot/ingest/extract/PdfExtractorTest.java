package com.deskpilot.ingest.extract;

import static org.junit.jupiter.api.Assertions.*;

import com.deskpilot.TestFixtures;
import com.deskpilot.model.ExtractedUnit;
import com.deskpilot.model.SourceDocument;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class PdfExtractorTest {

    private final PdfExtractor extractor = new PdfExtractor();

    @Test
    void shouldEmitOneUnitPerPageWithText() {
        byte[] pdf = TestFixtures.pdf("Reset the router first.", "", "Then call the helpdesk.");

        List<ExtractedUnit> units = extractor.extract(new SourceDocument("doc-1", "manual.pdf", "pdf", pdf, null, 1));

        assertEquals(2, units.size());
        assertEquals("page:1", units.get(0).label());
        assertEquals("Reset the router first.", units.get(0).text());
        assertEquals("page:3", units.get(1).label());
        assertEquals(3, units.get(1).attributes().get("page_count"));
    }

    @Test
    void shouldRejectCorruptPdf() {
        byte[] garbage = "plain text pretending to be a pdf".getBytes(StandardCharsets.US_ASCII);
        assertThrows(ExtractionException.class,
                () -> extractor.extract(new SourceDocument("doc-1", "broken.pdf", "pdf", garbage, null, 1)));
    }
}
