package com.intent.vision.core.dto;

public record CostEstimate(int credits, double usdEstimate) {

    public static final CostEstimate FREE = new CostEstimate(0, 0.0);
}
