package com.deskpilot.ingest.extract;

public class UnsupportedFormatException extends RuntimeException {
    private final String format;

    public UnsupportedFormatException(String format, String message) {
        super(message);
        this.format = format;
    }

    public String getFormat() {
        return this.format;
    }
}
