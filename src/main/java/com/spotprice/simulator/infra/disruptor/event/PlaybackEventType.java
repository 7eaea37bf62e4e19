package com.spotprice.simulator.infra.disruptor.event;

public enum PlaybackEventType {

    POINT,
    REGIME_CHANGE,
    OVERRUN,
    COMPLETE,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETE || this == CANCELLED;
    }
}
