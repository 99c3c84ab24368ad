package com.deskpilot.model;

import java.util.Map;

/**
 * A logical section of extracted text (a page, a sheet row range, an OCR result) with the
 * structural label that locates it inside its source document.
 */
public record ExtractedUnit(String documentId, String text, String label, double extractionConfidence, Map<String, Object> attributes) {

    public static final String DOCUMENT_LABEL = "document";
    public static final String OCR_LABEL = "ocr-block";

    public ExtractedUnit {
        text = text == null ? "" : text;
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        if (extractionConfidence < 0.0 || extractionConfidence > 1.0) {
            throw new IllegalArgumentException("extractionConfidence must be within [0,1]: " + extractionConfidence);
        }
    }

    public static ExtractedUnit exact(String documentId, String text, String label) {
        return new ExtractedUnit(documentId, text, label, 1.0, Map.of());
    }

    public boolean isBlank() {
        return this.text.isBlank();
    }
}
