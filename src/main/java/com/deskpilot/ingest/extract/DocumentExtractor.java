package com.deskpilot.ingest.extract;

import com.deskpilot.model.ExtractedUnit;
import com.deskpilot.model.SourceDocument;
import java.util.List;
import java.util.Set;

/**
 * Turns the raw payload of one format family into extracted units. Implementations must be
 * side-effect free and thread-safe; they are shared singletons.
 */
public interface DocumentExtractor {

    FormatFamily family();

    /**
     * Normalized format identifiers (lower-case extensions without the dot) this extractor handles.
     */
    Set<String> formats();

    /**
     * @throws ExtractionException if the payload cannot be parsed
     */
    List<ExtractedUnit> extract(SourceDocument document);
}
