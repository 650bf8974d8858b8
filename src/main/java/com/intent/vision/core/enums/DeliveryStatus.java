package com.intent.vision.core.enums;

/**
 * Per-channel and overall delivery state of a triggered alert.
 * QUEUED is only used as an overall status: nothing was attempted because
 * no transport was configured.
 */
public enum DeliveryStatus {
    SENT,
    FAILED,
    SKIPPED,
    QUEUED
}
