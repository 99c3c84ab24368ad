package com.deskpilot.ingest.extract;

public record OcrBlock(String text, double confidence) {
}
