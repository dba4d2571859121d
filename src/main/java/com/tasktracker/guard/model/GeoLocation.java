package com.tasktracker.guard.model;

public record GeoLocation(String country, String city) {

    public static final GeoLocation LOCAL = new GeoLocation("Local", "Local");
    public static final GeoLocation UNKNOWN = new GeoLocation("Unknown", "Unknown");

    public String label() {
        return country + ", " + city;
    }
}
