package com.spotprice.simulator.infra.display;

import com.lmax.disruptor.RingBuffer;
import com.spotprice.simulator.domain.model.PricePoint;
import com.spotprice.simulator.domain.model.VolatilityRegime;
import com.spotprice.simulator.domain.service.playback.PlaybackListener;
import com.spotprice.simulator.infra.disruptor.event.PlaybackEvent;
import com.spotprice.simulator.infra.disruptor.event.PlaybackEventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Moves playback callbacks off the pacing thread. Points are offered with {@code tryPublishEvent}
 * and dropped from the display when the ring buffer is full. Regime, overrun and terminal events
 * are rare and always published.
 */
@Slf4j
@Primary
@Component
public class DisruptorDisplayBridge implements PlaybackListener {

    private final RingBuffer<PlaybackEvent> displayRingBuffer;
    private final Counter droppedPointCounter;

    public DisruptorDisplayBridge(RingBuffer<PlaybackEvent> displayRingBuffer, MeterRegistry meterRegistry) {
        this.displayRingBuffer = displayRingBuffer;
        this.droppedPointCounter = Counter.builder("display.events.dropped")
                .tag("event", PlaybackEventType.POINT.name())
                .description("Display events dropped because the ring buffer was full")
                .register(meterRegistry);
    }

    @Override
    public void onPoint(PricePoint point) {
        boolean published = displayRingBuffer.tryPublishEvent((event, sequence) -> {
            event.clear();
            event.setType(PlaybackEventType.POINT);
            event.setPoint(point);
            event.setTimestamp(point.timestamp());
            event.setPublishNanoTime(System.nanoTime());
        });
        if (!published) {
            droppedPointCounter.increment();
            log.debug("[Display] 링버퍼 가득 참, 표시 포인트 생략: t={}s", point.timestamp());
        }
    }

    @Override
    public void onRegimeChange(VolatilityRegime regime, double timestamp) {
        displayRingBuffer.publishEvent((event, sequence) -> {
            event.clear();
            event.setType(PlaybackEventType.REGIME_CHANGE);
            event.setRegime(regime);
            event.setTimestamp(timestamp);
            event.setPublishNanoTime(System.nanoTime());
        });
    }

    @Override
    public void onOverrun(Duration lag, int index) {
        displayRingBuffer.publishEvent((event, sequence) -> {
            event.clear();
            event.setType(PlaybackEventType.OVERRUN);
            event.setLagNanos(lag.toNanos());
            event.setIndex(index);
            event.setPublishNanoTime(System.nanoTime());
        });
    }

    @Override
    public void onComplete() {
        publishTerminal(PlaybackEventType.COMPLETE);
    }

    @Override
    public void onCancelled() {
        publishTerminal(PlaybackEventType.CANCELLED);
    }

    private void publishTerminal(PlaybackEventType type) {
        displayRingBuffer.publishEvent((event, sequence) -> {
            event.clear();
            event.setType(type);
            event.setPublishNanoTime(System.nanoTime());
        });
    }
}
