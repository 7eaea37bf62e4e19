package com.spotprice.simulator.domain.service.regime;

import com.spotprice.simulator.domain.model.VolatilityRegime;

import java.util.SplittableRandom;

public class RegimeScheduler {

    static final double BOUNDARY_EPSILON = 1e-9;

    private static final VolatilityRegime[] REGIMES = VolatilityRegime.values();

    private final double switchIntervalSeconds;

    private SplittableRandom random;
    private VolatilityRegime currentRegime;
    private double segmentStartTime;
    private double nextSwitchTime;

    public RegimeScheduler(double switchIntervalSeconds) {
        if (switchIntervalSeconds <= 0) {
            throw new IllegalArgumentException("전환 주기(switchIntervalSeconds)는 양수여야 합니다");
        }
        this.switchIntervalSeconds = switchIntervalSeconds;
    }

    public void initialize(SplittableRandom randomSource) {
        this.random = randomSource;
        this.currentRegime = draw();
        this.segmentStartTime = 0.0;
        this.nextSwitchTime = switchIntervalSeconds;
    }

    public boolean advance(double elapsedTime) {
        if (random == null) {
            throw new IllegalStateException("initialize()가 먼저 호출되어야 합니다");
        }
        if (elapsedTime + BOUNDARY_EPSILON < nextSwitchTime) {
            return false;
        }
        // elapsed time is a multiple of the tick, so the boundary can be a few ulps short
        while (elapsedTime + BOUNDARY_EPSILON >= nextSwitchTime) {
            segmentStartTime = nextSwitchTime;
            nextSwitchTime += switchIntervalSeconds;
            currentRegime = draw();
        }
        return true;
    }

    public VolatilityRegime currentRegime() {
        return currentRegime;
    }

    public double segmentStartTime() {
        return segmentStartTime;
    }

    public double nextSwitchTime() {
        return nextSwitchTime;
    }

    private VolatilityRegime draw() {
        return REGIMES[random.nextInt(REGIMES.length)];
    }
}
