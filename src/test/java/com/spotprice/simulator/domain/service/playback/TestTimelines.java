package com.spotprice.simulator.domain.service.playback;

import com.spotprice.simulator.domain.model.PricePoint;
import com.spotprice.simulator.domain.model.RegimeSegment;
import com.spotprice.simulator.domain.model.SimulationParameters;
import com.spotprice.simulator.domain.model.SimulationTimeline;
import com.spotprice.simulator.domain.model.VolatilityRegime;

import java.util.ArrayList;
import java.util.List;

final class TestTimelines {

    static final double TICK_SECONDS = 0.2;

    private TestTimelines() {
    }

    /**
     * Synthetic timeline: regimes rotate every {@code segmentLength} points, every tenth point is a jump.
     */
    static SimulationTimeline of(int size, int segmentLength) {
        VolatilityRegime[] regimes = VolatilityRegime.values();
        List<PricePoint> points = new ArrayList<>(size);
        List<RegimeSegment> segments = new ArrayList<>();

        for (int i = 0; i < size; i++) {
            VolatilityRegime regime = regimes[(i / segmentLength) % regimes.length];
            if (i % segmentLength == 0) {
                segments.add(new RegimeSegment(i, i * TICK_SECONDS, regime));
            }
            points.add(new PricePoint(i * TICK_SECONDS, 100.0 + (i % 7), regime, i % 10 == 9));
        }

        return new SimulationTimeline(SimulationParameters.builder().build(), 1L, TICK_SECONDS, 100.0,
                points, segments);
    }

    static SimulationTimeline of(int size) {
        return of(size, 150);
    }
}
