package com.nei10u.panchanga.model;

public enum Paksha {
    SHUKLA("Shukla Paksha", "शुक्ल पक्ष"),   // 上弦（渐盈）
    KRISHNA("Krishna Paksha", "कृष्ण पक्ष"); // 下弦（渐亏）

    private static final int TITHIS_PER_PAKSHA = 15;

    private final String displayName;
    private final String sanskrit;

    Paksha(String displayName, String sanskrit) {
        this.displayName = displayName;
        this.sanskrit = sanskrit;
    }

    /**
     * Tithi 1..15 属于 Shukla，16..30 属于 Krishna。
     */
    public static Paksha fromTithiNumber(int tithiNumber) {
        return tithiNumber <= TITHIS_PER_PAKSHA ? SHUKLA : KRISHNA;
    }

    public boolean isWaxing() {
        return this == SHUKLA;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getSanskrit() {
        return sanskrit;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
