package com.tasktracker.guard.model;

public record DeviceInfo(String deviceType, String browser, String operatingSystem) {

    public String label() {
        return deviceType + " - " + browser;
    }
}
