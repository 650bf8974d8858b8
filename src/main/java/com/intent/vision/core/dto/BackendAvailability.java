package com.intent.vision.core.dto;

public record BackendAvailability(boolean available, String reason) {

    public static BackendAvailability yes() {
        return new BackendAvailability(true, null);
    }

    public static BackendAvailability no(String reason) {
        return new BackendAvailability(false, reason);
    }
}
