package com.nei10u.panchanga.model;

public record YogaName(int number, String name, String sanskrit, YogaNature nature) {
}
