package com.deskpilot.model;

public enum AnswerOutcome {
    ANSWERED,
    NO_INFORMATION,
    GENERATION_FAILED
}
