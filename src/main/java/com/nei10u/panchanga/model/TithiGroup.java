package com.nei10u.panchanga.model;

public enum TithiGroup {
    NANDA("Nanda", "Joyful"),
    BHADRA("Bhadra", "Auspicious"),
    JAYA("Jaya", "Victorious"),
    RIKTA("Rikta", "Empty"),
    PURNA("Purna", "Complete");

    private final String displayName;
    private final String nature;

    TithiGroup(String displayName, String nature) {
        this.displayName = displayName;
        this.nature = nature;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getNature() {
        return nature;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
