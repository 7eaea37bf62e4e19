package com.spotprice.simulator.infra.disruptor.event;

import com.lmax.disruptor.EventFactory;

public class PlaybackEventFactory implements EventFactory<PlaybackEvent> {

    @Override
    public PlaybackEvent newInstance() {
        return new PlaybackEvent();
    }
}
