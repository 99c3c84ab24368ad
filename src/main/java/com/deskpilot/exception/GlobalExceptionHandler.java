package com.deskpilot.exception;

import com.deskpilot.embedding.EmbeddingException;
import com.deskpilot.ingest.extract.ExtractionException;
import com.deskpilot.ingest.extract.UnsupportedFormatException;
import com.deskpilot.service.DocumentIngestionException;
import com.deskpilot.util.LogSanitizer;
import com.deskpilot.vector.IndexUnavailableException;
import java.time.Instant;
import java.util.ConcurrentModificationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final Pattern PACKAGE_PATTERN = Pattern.compile("\\w+(\\.\\w+){2,}");

    /**
     * Ingestion failures are reported by their cause, with the document id for the caller.
     */
    @ExceptionHandler(DocumentIngestionException.class)
    public ResponseEntity<Map<String, Object>> handleIngestion(DocumentIngestionException ex) {
        Throwable cause = ex.getCause();
        HttpStatus status = statusFor(cause);
        log.warn("Ingestion of {} rejected with {}: {}", LogSanitizer.sanitize(ex.getFilename()), status.value(),
                cause != null ? cause.getMessage() : ex.getMessage());
        Map<String, Object> body = body(cause != null ? sanitizeExceptionMessage(cause.getMessage()) : "Ingestion failed");
        body.put("documentId", ex.getDocumentId());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(UnsupportedFormatException.class)
    public ResponseEntity<Map<String, Object>> handleUnsupported(UnsupportedFormatException ex) {
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE).body(body(sanitizeExceptionMessage(ex.getMessage())));
    }

    @ExceptionHandler(ExtractionException.class)
    public ResponseEntity<Map<String, Object>> handleExtraction(ExtractionException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body("Document content could not be extracted"));
    }

    @ExceptionHandler(EmbeddingException.class)
    public ResponseEntity<Map<String, Object>> handleEmbedding(EmbeddingException ex) {
        log.warn("Embedding failure: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body("Embedding service failed"));
    }

    @ExceptionHandler(IndexUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleIndexUnavailable(IndexUnavailableException ex) {
        log.error("Knowledge index unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body("Knowledge index unavailable"));
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body(sanitizeExceptionMessage(ex.getMessage())));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleTooLarge(MaxUploadSizeExceededException ex) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(body("Uploaded file is too large"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body("Internal server error"));
    }

    static HttpStatus statusFor(Throwable cause) {
        if (cause instanceof UnsupportedFormatException) {
            return HttpStatus.UNSUPPORTED_MEDIA_TYPE;
        }
        if (cause instanceof ExtractionException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (cause instanceof EmbeddingException) {
            return HttpStatus.BAD_GATEWAY;
        }
        if (cause instanceof IndexUnavailableException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (cause instanceof IllegalArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (cause instanceof ConcurrentModificationException) {
            return HttpStatus.CONFLICT;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static Map<String, Object> body(String message) {
        LinkedHashMap<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }

    static String sanitizeExceptionMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Invalid request";
        }
        // no paths, class names or stack-trace fragments in client responses
        if (message.contains("/") || message.contains("\\")
                || message.contains("Exception") || message.contains(" at ")
                || PACKAGE_PATTERN.matcher(message).find()
                || message.length() > 200) {
            return "Invalid request";
        }
        return message;
    }
}
