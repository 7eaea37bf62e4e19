package com.spotprice.simulator.domain.model;

public record PricePoint(double timestamp, double price, VolatilityRegime regime, boolean jumpOccurred) {

    public PricePoint {
        if (regime == null) {
            throw new IllegalArgumentException("regime must not be null");
        }
        if (timestamp < 0) {
            throw new IllegalArgumentException("timestamp must not be negative");
        }
    }
}
