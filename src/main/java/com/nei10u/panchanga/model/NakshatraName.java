package com.nei10u.panchanga.model;

public record NakshatraName(int number, String name, Planet ruler, String deity) {
}
