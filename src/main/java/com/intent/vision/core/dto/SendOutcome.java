package com.intent.vision.core.dto;

public record SendOutcome(boolean success, String externalId, String error) {

    public static SendOutcome sent(String externalId) {
        return new SendOutcome(true, externalId, null);
    }

    public static SendOutcome failed(String error) {
        return new SendOutcome(false, null, error);
    }
}
