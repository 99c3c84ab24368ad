package com.deskpilot.ingest.extract;

public enum FormatFamily {
    TEXT,
    DOCUMENT,
    SPREADSHEET,
    IMAGE
}
