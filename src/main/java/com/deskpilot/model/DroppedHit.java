package com.deskpilot.model;

public record DroppedHit(RetrievalHit hit, DropReason reason) {
}
