package com.intent.vision.core.dto;

/**
 * Remaining daily budget of one backend. {@code remaining = -1} means unlimited.
 */
public record QuotaStatus(boolean allowed, long current, int limit, long remaining, String upgradeMessage) {
}
