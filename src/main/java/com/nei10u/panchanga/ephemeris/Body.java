package com.nei10u.panchanga.ephemeris;

public enum Body {
    SUN,
    MOON
}
