package com.spotprice.simulator.domain.model;

public record RegimeSegment(int startIndex, double startTime, VolatilityRegime regime) {

    public RegimeSegment {
        if (regime == null) {
            throw new IllegalArgumentException("regime must not be null");
        }
        if (startIndex < 0) {
            throw new IllegalArgumentException("startIndex must not be negative");
        }
    }
}
