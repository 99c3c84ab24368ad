package com.deskpilot.ingest.extract;

import com.deskpilot.model.ExtractedUnit;
import com.deskpilot.model.SourceDocument;
import com.deskpilot.util.TextNormalizer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class PlainTextExtractor implements DocumentExtractor {

    @Override
    public FormatFamily family() {
        return FormatFamily.TEXT;
    }

    @Override
    public Set<String> formats() {
        return Set.of("txt", "md");
    }

    @Override
    public List<ExtractedUnit> extract(SourceDocument document) {
        String decoded;
        try {
            decoded = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(document.payload()))
                    .toString();
        }
        catch (CharacterCodingException e) {
            throw new ExtractionException("Unable to decode text file as UTF-8: " + document.filename(), e);
        }
        String text = TextNormalizer.clean(decoded);
        if (text.isBlank()) {
            return List.of();
        }
        return List.of(new ExtractedUnit(document.id(), text, ExtractedUnit.DOCUMENT_LABEL, 1.0,
                Map.of("encoding", "utf-8", "length", text.length())));
    }
}
