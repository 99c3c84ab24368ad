package com.deskpilot.model;

public enum DropReason {
    DUPLICATE,
    BUDGET
}
