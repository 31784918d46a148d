package com.nei10u.panchanga.model;

public record KaranaName(String name, String sanskrit, KaranaType type) {
}
