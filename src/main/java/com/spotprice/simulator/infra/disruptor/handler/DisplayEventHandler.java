package com.spotprice.simulator.infra.disruptor.handler;

import com.lmax.disruptor.EventHandler;
import com.spotprice.simulator.domain.service.playback.PlaybackListener;
import com.spotprice.simulator.infra.disruptor.event.PlaybackEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

@Slf4j
@RequiredArgsConstructor
public class DisplayEventHandler implements EventHandler<PlaybackEvent> {

    private final PlaybackListener sink;

    @Override
    public void onEvent(PlaybackEvent event, long sequence, boolean endOfBatch) {
        if (event.getType() == null) return;

        switch (event.getType()) {
            case POINT -> sink.onPoint(event.getPoint());
            case REGIME_CHANGE -> sink.onRegimeChange(event.getRegime(), event.getTimestamp());
            case OVERRUN -> sink.onOverrun(Duration.ofNanos(event.getLagNanos()), event.getIndex());
            case COMPLETE -> sink.onComplete();
            case CANCELLED -> sink.onCancelled();
            default -> { }
        }

        if (event.getType().isTerminal()) {
            log.debug("[Display] 종료 이벤트 처리: type={}, handoff={}μs",
                    event.getType(), (System.nanoTime() - event.getPublishNanoTime()) / 1_000);
        }
    }
}
