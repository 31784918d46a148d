package com.nei10u.panchanga.model;

public enum KaranaType {
    FIXED("Fixed"),     // 每个周期至多出现一次
    MOVABLE("Movable"); // 七个一组循环

    private final String displayName;

    KaranaType(String displayName) {
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
