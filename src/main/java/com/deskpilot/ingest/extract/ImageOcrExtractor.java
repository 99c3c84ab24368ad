package com.deskpilot.ingest.extract;

import com.deskpilot.model.ExtractedUnit;
import com.deskpilot.model.SourceDocument;
import com.deskpilot.util.LogSanitizer;
import com.deskpilot.util.TextNormalizer;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Scanned images. Emits a single {@code ocr-block} unit whose confidence is the mean
 * per-block recognizer confidence, or nothing when the recognized text is empty or below
 * the configured threshold. A document that yields no unit is "not indexable", not an error.
 */
@Component
public class ImageOcrExtractor implements DocumentExtractor {
    private static final Logger log = LoggerFactory.getLogger(ImageOcrExtractor.class);

    private final OcrClient ocrClient;

    @Value("${deskpilot.ingest.ocr.min-confidence:0.6}")
    private double minConfidence = 0.6;

    public ImageOcrExtractor(OcrClient ocrClient) {
        this.ocrClient = ocrClient;
    }

    @Override
    public FormatFamily family() {
        return FormatFamily.IMAGE;
    }

    @Override
    public Set<String> formats() {
        return Set.of("png", "jpg", "jpeg");
    }

    @Override
    public List<ExtractedUnit> extract(SourceDocument document) {
        String safeName = LogSanitizer.sanitize(document.filename());
        BufferedImage image = decode(document);
        if (!this.ocrClient.isEnabled()) {
            log.warn("OCR disabled; image {} is not indexable", safeName);
            return List.of();
        }
        OcrResult result = this.ocrClient.recognize(document.payload(), document.filename());
        String text = TextNormalizer.clean(result.text());
        double confidence = result.meanConfidence();
        if (text.isBlank()) {
            log.info("OCR found no text in {}", safeName);
            return List.of();
        }
        if (confidence < this.minConfidence) {
            log.info("OCR confidence {} below threshold {} for {}; not indexing", String.format("%.2f", confidence),
                    this.minConfidence, safeName);
            return List.of();
        }
        LinkedHashMap<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("image_width", image.getWidth());
        attributes.put("image_height", image.getHeight());
        attributes.put("ocr_blocks", result.blocks().size());
        return List.of(new ExtractedUnit(document.id(), text, ExtractedUnit.OCR_LABEL, confidence, attributes));
    }

    private static BufferedImage decode(SourceDocument document) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(document.payload()));
            if (image == null) {
                throw new ExtractionException("Unreadable image: " + document.filename());
            }
            return image;
        }
        catch (IOException e) {
            throw new ExtractionException("Error processing image file " + document.filename() + ": " + e.getMessage(), e);
        }
    }
}
