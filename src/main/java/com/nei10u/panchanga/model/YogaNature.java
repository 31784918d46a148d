package com.nei10u.panchanga.model;

public enum YogaNature {
    AUSPICIOUS("Auspicious"),
    INAUSPICIOUS("Inauspicious"),
    MIXED("Mixed");

    private final String displayName;

    YogaNature(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
