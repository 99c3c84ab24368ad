package com.deskpilot.controller;

import com.deskpilot.ingest.extract.FormatFamily;
import com.deskpilot.model.AnswerResult;
import com.deskpilot.model.IngestionResult;
import com.deskpilot.model.QueryOptions;
import com.deskpilot.service.DocumentIngestionService;
import com.deskpilot.service.KnowledgeAnswerService;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/knowledge")
public class KnowledgeController {
    private final DocumentIngestionService ingestionService;
    private final KnowledgeAnswerService answerService;

    public KnowledgeController(DocumentIngestionService ingestionService, KnowledgeAnswerService answerService) {
        this.ingestionService = ingestionService;
        this.answerService = answerService;
    }

    @PostMapping("/documents")
    public ResponseEntity<IngestionResult> ingest(@RequestParam("file") MultipartFile file,
            @RequestParam(value = "format", required = false) String format,
            @RequestParam(value = "documentId", required = false) String documentId) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("No file uploaded");
        }
        IngestionResult result = this.ingestionService.ingestDocument(file.getOriginalFilename(), file.getBytes(), format, documentId);
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @DeleteMapping("/documents/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") String documentId) {
        this.ingestionService.deleteDocument(documentId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/formats")
    public Map<FormatFamily, List<String>> formats() {
        return this.ingestionService.supportedFormats();
    }

    @RequestMapping(value = "/answer", method = { RequestMethod.GET, RequestMethod.POST })
    public AnswerResult answer(@RequestParam(value = "q", defaultValue = "") String question,
            @RequestParam(value = "includeTickets", defaultValue = "true") boolean includeTickets,
            @RequestParam(value = "includeKb", defaultValue = "true") boolean includeKb,
            @RequestParam(value = "category", required = false) String category) {
        return this.answerService.answer(question, new QueryOptions(includeTickets, includeKb, category));
    }
}
