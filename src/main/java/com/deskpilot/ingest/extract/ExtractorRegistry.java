package com.deskpilot.ingest.extract;

import com.deskpilot.model.ExtractedUnit;
import com.deskpilot.model.SourceDocument;
import com.deskpilot.util.LogSanitizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Format router: maps a normalized format identifier to the extractor registered for it.
 * Built once from every {@link DocumentExtractor} bean; unknown formats fail closed.
 */
@Component
public class ExtractorRegistry {
    private static final Logger log = LoggerFactory.getLogger(ExtractorRegistry.class);
    private static final Map<String, String> MIME_TO_FORMAT = Map.ofEntries(
            Map.entry("text/plain", "txt"),
            Map.entry("text/markdown", "md"),
            Map.entry("text/x-web-markdown", "md"),
            Map.entry("application/pdf", "pdf"),
            Map.entry("application/vnd.openxmlformats-officedocument.wordprocessingml.document", "docx"),
            Map.entry("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", "xlsx"),
            Map.entry("application/vnd.ms-excel", "xls"),
            Map.entry("application/x-tika-msoffice", "xls"),
            Map.entry("application/x-tika-ooxml", "xlsx"),
            Map.entry("image/png", "png"),
            Map.entry("image/jpeg", "jpg"),
            Map.entry("image/jpg", "jpg"));

    private final Map<String, DocumentExtractor> byFormat;
    private final Tika tika = new Tika();

    public ExtractorRegistry(List<DocumentExtractor> extractors) {
        HashMap<String, DocumentExtractor> registered = new HashMap<>();
        for (DocumentExtractor extractor : extractors) {
            for (String format : extractor.formats()) {
                String key = format.toLowerCase(Locale.ROOT);
                DocumentExtractor previous = registered.putIfAbsent(key, extractor);
                if (previous != null) {
                    throw new IllegalStateException("Format '" + key + "' registered by both "
                            + previous.getClass().getSimpleName() + " and " + extractor.getClass().getSimpleName());
                }
            }
        }
        this.byFormat = Collections.unmodifiableMap(registered);
        log.info("Extractor registry initialized with formats {}", new TreeSet<>(this.byFormat.keySet()));
    }

    /**
     * Resolves what the caller declared (extension, ".ext", MIME type or nothing) into a format
     * identifier. A blank declaration falls back to the filename extension and then to content
     * sniffing. The result is not guaranteed to be registered.
     */
    public String resolveFormat(String declaredFormat, String filename, byte[] payload) {
        String declared = normalize(declaredFormat);
        if (!declared.isEmpty()) {
            return declared;
        }
        String extension = normalize(extensionOf(filename));
        if (!extension.isEmpty()) {
            return extension;
        }
        if (payload != null && payload.length > 0) {
            String sniffed = normalize(this.tika.detect(payload, filename));
            log.debug("No declared format for {}, content detected as {}", LogSanitizer.sanitize(filename), sniffed);
            return sniffed;
        }
        return "";
    }

    public boolean supports(String format) {
        return this.byFormat.containsKey(normalize(format));
    }

    public DocumentExtractor extractorFor(String format) {
        String key = normalize(format);
        DocumentExtractor extractor = this.byFormat.get(key);
        if (extractor == null) {
            throw new UnsupportedFormatException(key, "Unsupported file type: '" + LogSanitizer.sanitize(format)
                    + "'. Supported formats: " + new TreeSet<>(this.byFormat.keySet()));
        }
        return extractor;
    }

    public List<ExtractedUnit> extract(SourceDocument document) {
        DocumentExtractor extractor = this.extractorFor(document.format());
        List<ExtractedUnit> units = extractor.extract(document);
        return units == null ? List.of() : units;
    }

    public Map<FormatFamily, List<String>> supportedFormats() {
        EnumMap<FormatFamily, TreeSet<String>> grouped = new EnumMap<>(FormatFamily.class);
        for (Map.Entry<String, DocumentExtractor> entry : this.byFormat.entrySet()) {
            grouped.computeIfAbsent(entry.getValue().family(), f -> new TreeSet<>()).add(entry.getKey());
        }
        EnumMap<FormatFamily, List<String>> result = new EnumMap<>(FormatFamily.class);
        grouped.forEach((family, formats) -> result.put(family, List.copyOf(new ArrayList<>(formats))));
        return result;
    }

    static String normalize(String format) {
        if (format == null) {
            return "";
        }
        String value = format.trim().toLowerCase(Locale.ROOT);
        int params = value.indexOf(';');
        if (params >= 0) {
            value = value.substring(0, params).trim();
        }
        if (value.contains("/")) {
            return MIME_TO_FORMAT.getOrDefault(value, value);
        }
        while (value.startsWith(".")) {
            value = value.substring(1);
        }
        return value;
    }

    private static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int lastDot = filename.lastIndexOf('.');
        return lastDot > 0 && lastDot < filename.length() - 1 ? filename.substring(lastDot + 1) : "";
    }
}
