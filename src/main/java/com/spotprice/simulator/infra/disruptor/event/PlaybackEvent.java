package com.spotprice.simulator.infra.disruptor.event;

import com.spotprice.simulator.domain.model.PricePoint;
import com.spotprice.simulator.domain.model.VolatilityRegime;

public class PlaybackEvent {

    private PlaybackEventType type;
    private PricePoint point;
    private VolatilityRegime regime;
    private double timestamp;
    private long lagNanos;
    private int index;
    private long publishNanoTime;

    public void clear() {
        type = null;
        point = null;
        regime = null;
        timestamp = 0.0;
        lagNanos = 0L;
        index = 0;
        publishNanoTime = 0L;
    }

    public PlaybackEventType getType() {
        return type;
    }

    public void setType(PlaybackEventType type) {
        this.type = type;
    }

    public PricePoint getPoint() {
        return point;
    }

    public void setPoint(PricePoint point) {
        this.point = point;
    }

    public VolatilityRegime getRegime() {
        return regime;
    }

    public void setRegime(VolatilityRegime regime) {
        this.regime = regime;
    }

    public double getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(double timestamp) {
        this.timestamp = timestamp;
    }

    public long getLagNanos() {
        return lagNanos;
    }

    public void setLagNanos(long lagNanos) {
        this.lagNanos = lagNanos;
    }

    public int getIndex() {
        return index;
    }

    public void setIndex(int index) {
        this.index = index;
    }

    public long getPublishNanoTime() {
        return publishNanoTime;
    }

    public void setPublishNanoTime(long publishNanoTime) {
        this.publishNanoTime = publishNanoTime;
    }

    @Override
    public String toString() {
        return "PlaybackEvent{type=" + type + ", point=" + point + ", regime=" + regime
                + ", index=" + index + "}";
    }
}
