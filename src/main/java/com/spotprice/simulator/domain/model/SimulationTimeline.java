package com.spotprice.simulator.domain.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Getter
public final class SimulationTimeline {

    private final SimulationParameters parameters;
    private final Long seed;
    private final double tickSeconds;
    private final double initialPrice;
    private final List<PricePoint> points;
    private final List<RegimeSegment> segments;

    @Getter(AccessLevel.NONE)
    private final Map<Integer, RegimeSegment> segmentsByStartIndex;

    public SimulationTimeline(SimulationParameters parameters,
                              Long seed,
                              double tickSeconds,
                              double initialPrice,
                              List<PricePoint> points,
                              List<RegimeSegment> segments) {
        if (parameters == null || points == null || segments == null) {
            throw new IllegalArgumentException("parameters, points and segments must not be null");
        }
        this.parameters = parameters;
        this.seed = seed;
        this.tickSeconds = tickSeconds;
        this.initialPrice = initialPrice;
        this.points = List.copyOf(points);
        this.segments = List.copyOf(segments);

        Map<Integer, RegimeSegment> byIndex = new HashMap<>();
        for (RegimeSegment segment : this.segments) {
            byIndex.put(segment.startIndex(), segment);
        }
        this.segmentsByStartIndex = Map.copyOf(byIndex);
    }

    public int size() {
        return points.size();
    }

    public PricePoint get(int index) {
        return points.get(index);
    }

    public Optional<RegimeSegment> segmentStartingAt(int index) {
        return Optional.ofNullable(segmentsByStartIndex.get(index));
    }

    public TimelineStatistics statistics() {
        return TimelineStatistics.of(points);
    }
}
