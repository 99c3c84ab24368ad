package com.deskpilot.ingest.extract;

/**
 * Optical character recognition collaborator.
 */
public interface OcrClient {

    boolean isEnabled();

    /**
     * @throws ExtractionException if the recognizer cannot be reached or rejects the image
     */
    OcrResult recognize(byte[] imageBytes, String filename);
}
