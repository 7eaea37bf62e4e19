package com.spotprice.simulator.domain.service.session;

import com.spotprice.simulator.domain.model.SimulationParameters;
import com.spotprice.simulator.domain.model.SimulationTimeline;
import com.spotprice.simulator.domain.service.playback.PlaybackController;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

@Getter
@ToString(of = {"id", "parameters", "startedAt"})
public class SimulationSession {

    private final String id;
    private final SimulationParameters parameters;
    private final SimulationTimeline timeline;
    private final PlaybackController controller;
    private final Instant startedAt;

    SimulationSession(SimulationParameters parameters,
                      SimulationTimeline timeline,
                      PlaybackController controller) {
        this.id = UUID.randomUUID().toString();
        this.parameters = parameters;
        this.timeline = timeline;
        this.controller = controller;
        this.startedAt = Instant.now();
    }
}
