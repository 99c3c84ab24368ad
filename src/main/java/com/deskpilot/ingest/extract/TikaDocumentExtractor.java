package com.deskpilot.ingest.extract;

import com.deskpilot.model.ExtractedUnit;
import com.deskpilot.model.SourceDocument;
import com.deskpilot.util.LogSanitizer;
import com.deskpilot.util.TextNormalizer;
import java.io.ByteArrayInputStream;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.xml.parsers.SAXParserFactory;
import org.apache.tika.exception.WriteLimitReachedException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Word-processor documents through Tika's auto-detecting parser.
 */
@Component
public class TikaDocumentExtractor implements DocumentExtractor {
    private static final Logger log = LoggerFactory.getLogger(TikaDocumentExtractor.class);

    @Value("${deskpilot.ingest.tika.max-chars:1000000}")
    private int maxChars = 1_000_000;

    @Override
    public FormatFamily family() {
        return FormatFamily.DOCUMENT;
    }

    @Override
    public Set<String> formats() {
        return Set.of("docx");
    }

    @Override
    public List<ExtractedUnit> extract(SourceDocument document) {
        BodyContentHandler handler = new BodyContentHandler(this.maxChars);
        Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, document.filename());
        try {
            AutoDetectParser parser = new AutoDetectParser();
            ParseContext context = new ParseContext();
            SAXParserFactory spf = SAXParserFactory.newInstance();
            spf.setFeature("http://xml.org/sax/features/external-general-entities", false);
            spf.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            spf.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            context.set(SAXParserFactory.class, spf);
            parser.parse(new ByteArrayInputStream(document.payload()), handler, metadata, context);
        }
        catch (Exception e) {
            if (!WriteLimitReachedException.isWriteLimitReached(e)) {
                throw new ExtractionException("Error processing document " + document.filename() + ": " + e.getMessage(), e);
            }
            log.warn("Tika output for {} truncated at {} chars", LogSanitizer.sanitize(document.filename()), this.maxChars);
        }
        String text = TextNormalizer.clean(handler.toString());
        if (text.isBlank()) {
            return List.of();
        }
        return List.of(new ExtractedUnit(document.id(), text, ExtractedUnit.DOCUMENT_LABEL, 1.0,
                Map.of("length", text.length())));
    }
}
