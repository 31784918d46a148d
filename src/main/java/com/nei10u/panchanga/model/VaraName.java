package com.nei10u.panchanga.model;

/**
 * @param index 0 = Sunday ... 6 = Saturday
 */
public record VaraName(int index, String name, String sanskrit, Planet lord) {
}
