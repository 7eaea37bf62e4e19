package com.spotprice.simulator;

import com.spotprice.simulator.domain.model.PlaybackSnapshot;
import com.spotprice.simulator.domain.model.PlaybackState;
import com.spotprice.simulator.domain.model.PricePoint;
import com.spotprice.simulator.domain.model.SimulationParameters;
import com.spotprice.simulator.domain.service.playback.PlaybackListener;
import com.spotprice.simulator.domain.service.session.SimulationService;
import com.spotprice.simulator.domain.service.session.SimulationSession;
import com.spotprice.simulator.domain.service.timeline.TimelineGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class SpotPriceSimulatorApplicationTests {

    @Autowired
    private SimulationService simulationService;

    @Autowired
    private TimelineGenerator timelineGenerator;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    @DisplayName("A seeded run replays the generated timeline point for point")
    void seededRunEndToEnd() throws Exception {
        SimulationParameters params = SimulationParameters.builder()
                .maxVolatility(20.0).meanReversionStrength(0.1).jumpFrequency(3.0).build();
        List<PricePoint> received = new CopyOnWriteArrayList<>();
        AtomicInteger completed = new AtomicInteger();

        SimulationSession session = simulationService.start(params, 2024L, new PlaybackListener() {
            @Override
            public void onPoint(PricePoint point) {
                received.add(point);
            }

            @Override
            public void onComplete() {
                completed.incrementAndGet();
            }

            @Override
            public void onCancelled() {
            }
        });

        assertThat(session.getController().awaitTermination(Duration.ofSeconds(30))).isTrue();

        PlaybackSnapshot snapshot = simulationService.snapshot(session);
        assertThat(snapshot.getState()).isEqualTo(PlaybackState.COMPLETED);
        assertThat(snapshot.getEmittedCount()).isEqualTo(900);
        assertThat(completed.get()).isEqualTo(1);
        assertThat(received).isEqualTo(timelineGenerator.generate(params, 2024L).getPoints());
    }

    @Test
    @DisplayName("The default run goes through the display hand-off and can be stopped")
    void defaultRunThroughDisplay() throws Exception {
        SimulationSession session = simulationService.start();

        assertThat(simulationService.stop(session)).isTrue();
        assertThat(session.getController().awaitTermination(Duration.ofSeconds(5))).isTrue();
        assertThat(session.getController().getState()).isEqualTo(PlaybackState.CANCELLED);
        assertThat(meterRegistry.find("display.ringbuffer.remaining").gauge()).isNotNull();
    }
}
