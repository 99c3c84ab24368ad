package com.deskpilot.model;

public enum HitSource {
    VECTOR,
    STRUCTURED
}
