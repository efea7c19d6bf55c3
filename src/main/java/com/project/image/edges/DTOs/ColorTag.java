package com.project.image.edges.DTOs;

/** Semantic group of an anchor, rendered with a fixed color by viewers. */
public enum ColorTag {
    PRIMARY("#facc15"),    // central axis
    SECONDARY("#38bdf8"),  // lateral field
    TERTIARY("#f472b6");   // base

    private final String hex;

    ColorTag(String hex) {
        this.hex = hex;
    }

    public String hex() {
        return hex;
    }
}
