package com.spotprice.simulator.domain.service.session;

import com.spotprice.simulator.domain.model.PlaybackSnapshot;
import com.spotprice.simulator.domain.model.SimulationParameters;
import com.spotprice.simulator.domain.model.SimulationTimeline;
import com.spotprice.simulator.domain.service.playback.PlaybackController;
import com.spotprice.simulator.domain.service.playback.PlaybackControllerFactory;
import com.spotprice.simulator.domain.service.playback.PlaybackListener;
import com.spotprice.simulator.domain.service.timeline.SimulationProperties;
import com.spotprice.simulator.domain.service.timeline.TimelineGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class SimulationService {

    private final TimelineGenerator timelineGenerator;
    private final PlaybackControllerFactory controllerFactory;
    private final SimulationProperties simulationProperties;
    private final PlaybackListener displayListener;

    public SimulationSession start() {
        return start(simulationProperties.defaultParameters(), null, displayListener);
    }

    public SimulationSession start(SimulationParameters parameters, Long seed) {
        return start(parameters, seed, displayListener);
    }

    public SimulationSession start(SimulationParameters parameters, Long seed, PlaybackListener listener) {
        SimulationTimeline timeline = timelineGenerator.generate(parameters, seed);
        PlaybackController controller = controllerFactory.create(timeline, listener);
        SimulationSession session = new SimulationSession(parameters, timeline, controller);

        controller.play();
        log.info("[Session] 시작: id={}, params={}, seed={}", session.getId(), parameters, seed);
        return session;
    }

    public boolean pause(SimulationSession session) {
        return session.getController().pause();
    }

    public boolean resume(SimulationSession session) {
        return session.getController().resume();
    }

    public boolean stop(SimulationSession session) {
        boolean accepted = session.getController().stop();
        if (accepted) {
            log.info("[Session] 중지 요청: id={}", session.getId());
        }
        return accepted;
    }

    public PlaybackSnapshot snapshot(SimulationSession session) {
        return session.getController().snapshot();
    }
}
