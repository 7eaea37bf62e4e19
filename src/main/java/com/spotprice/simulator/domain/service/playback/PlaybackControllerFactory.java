package com.spotprice.simulator.domain.service.playback;

import com.spotprice.simulator.common.DaemonThreads;
import com.spotprice.simulator.domain.model.SimulationTimeline;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
@RequiredArgsConstructor
public class PlaybackControllerFactory {

    private final PlaybackProperties properties;
    private final MeterRegistry meterRegistry;

    private final AtomicInteger runCounter = new AtomicInteger(0);

    public PlaybackController create(SimulationTimeline timeline, PlaybackListener listener) {
        return new PlaybackController(timeline, listener, properties, meterRegistry,
                DaemonThreads.named("playback-" + runCounter.incrementAndGet()));
    }
}
