package com.nei10u.panchanga.model;

/**
 * 九曜（Navagraha），用作各历法单位的主宰星。
 */
public enum Planet {
    SUN("Sun"),
    MOON("Moon"),
    MARS("Mars"),
    MERCURY("Mercury"),
    JUPITER("Jupiter"),
    VENUS("Venus"),
    SATURN("Saturn"),
    RAHU("Rahu"),   // 北交点
    KETU("Ketu");   // 南交点

    private final String displayName;

    Planet(String displayName) {
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
