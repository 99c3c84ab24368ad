package com.deskpilot.model;

public enum RecordKind {
    TICKET,
    KB_ARTICLE,
    DOCUMENT
}
