package com.spotprice.simulator.domain.model;

public enum PlaybackState {

    IDLE,
    RUNNING,
    PAUSED,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
