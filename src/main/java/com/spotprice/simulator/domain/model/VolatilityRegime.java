package com.spotprice.simulator.domain.model;

public enum VolatilityRegime {

    LOW(0.5, 1.0),
    MEDIUM(1.0, 1.5),
    HIGH(1.5, 2.0);

    private final double volatilityMultiplier;
    private final double jumpProbabilityMultiplier;

    VolatilityRegime(double volatilityMultiplier, double jumpProbabilityMultiplier) {
        this.volatilityMultiplier = volatilityMultiplier;
        this.jumpProbabilityMultiplier = jumpProbabilityMultiplier;
    }

    public double getVolatilityMultiplier() {
        return volatilityMultiplier;
    }

    public double getJumpProbabilityMultiplier() {
        return jumpProbabilityMultiplier;
    }

    public double effectiveVolatility(double maxVolatility) {
        return volatilityMultiplier * maxVolatility;
    }
}
