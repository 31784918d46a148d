package com.nei10u.panchanga.model;

public record TithiName(int number, String name, String sanskrit, TithiGroup group) {
}
