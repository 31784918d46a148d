package com.nei10u.panchanga.ephemeris;

public enum RiseSetEvent {
    RISE,
    SET
}
