package com.spotprice.simulator.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class PlaybackSnapshot {

    private final PlaybackState state;
    private final int emittedCount;
    private final int totalPoints;
    private final double currentPrice;
    private final double elapsedSeconds;
    private final VolatilityRegime regime;
    private final int jumpCount;

    public double progress() {
        return totalPoints == 0 ? 1.0 : (double) emittedCount / totalPoints;
    }
}
