package com.deskpilot.ingest.extract;

import com.deskpilot.util.LogSanitizer;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Client for the OCR microservice.
 *
 * Configuration:
 *   deskpilot.ocr.enabled: true/false
 *   deskpilot.ocr.service-url: http://localhost:8090
 *   deskpilot.ocr.timeout-seconds: 60
 *
 * The service answers {@code POST /ocr/image} with the recognized text split into blocks,
 * each carrying the recognizer's own confidence.
 */
@Service
public class HttpOcrClient implements OcrClient {
    private static final Logger log = LoggerFactory.getLogger(HttpOcrClient.class);

    private final RestTemplate restTemplate;

    @Value("${deskpilot.ocr.enabled:false}")
    private boolean enabled;

    @Value("${deskpilot.ocr.service-url:http://localhost:8090}")
    private String serviceUrl;

    @Value("${deskpilot.ocr.language:eng}")
    private String language;

    @Autowired
    public HttpOcrClient(@Value("${deskpilot.ocr.timeout-seconds:60}") int timeoutSeconds) {
        this(createNoRedirectRestTemplate(timeoutSeconds));
    }

    HttpOcrClient(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    // Redirects are not followed so a compromised OCR endpoint cannot bounce requests elsewhere.
    private static RestTemplate createNoRedirectRestTemplate(int timeoutSeconds) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory() {
            @Override
            protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
                super.prepareConnection(connection, httpMethod);
                connection.setInstanceFollowRedirects(false);
            }
        };
        int timeoutMs = Math.max(1, timeoutSeconds) * 1000;
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    @Override
    public boolean isEnabled() {
        return this.enabled;
    }

    @Override
    public OcrResult recognize(byte[] imageBytes, String filename) {
        if (!this.enabled) {
            log.debug("OCR service disabled, skipping image: {}", LogSanitizer.sanitize(filename));
            return OcrResult.empty();
        }
        OcrImageRequest request = new OcrImageRequest();
        request.imageBase64 = Base64.getEncoder().encodeToString(imageBytes);
        request.language = this.language;
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<OcrResponse> response = this.restTemplate.postForEntity(
                    this.serviceUrl + "/ocr/image", new HttpEntity<>(request, headers), OcrResponse.class);
            OcrResponse body = response.getBody();
            if (body == null || body.blocks == null) {
                return OcrResult.empty();
            }
            ArrayList<OcrBlock> blocks = new ArrayList<>(body.blocks.size());
            for (OcrBlockResponse block : body.blocks) {
                blocks.add(new OcrBlock(block.text, block.confidence));
            }
            log.info("OCR: {} block(s) from {} in {}ms", blocks.size(), LogSanitizer.sanitize(filename), body.processingTimeMs);
            return new OcrResult(blocks);
        }
        catch (RestClientException e) {
            throw new ExtractionException("OCR service unavailable for " + filename + ": " + e.getMessage(), e);
        }
    }

    static class OcrImageRequest {
        @JsonProperty("image_base64")
        public String imageBase64;
        @JsonProperty("language")
        public String language;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class OcrResponse {
        @JsonProperty("blocks")
        public List<OcrBlockResponse> blocks;
        @JsonProperty("processing_time_ms")
        public long processingTimeMs;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class OcrBlockResponse {
        @JsonProperty("text")
        public String text;
        @JsonProperty("confidence")
        public double confidence;
    }
}
