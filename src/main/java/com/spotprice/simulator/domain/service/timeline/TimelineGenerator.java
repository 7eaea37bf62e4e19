package com.spotprice.simulator.domain.service.timeline;

import com.spotprice.simulator.domain.model.PricePoint;
import com.spotprice.simulator.domain.model.RegimeSegment;
import com.spotprice.simulator.domain.model.SimulationParameters;
import com.spotprice.simulator.domain.model.SimulationTimeline;
import com.spotprice.simulator.domain.model.TimelineStatistics;
import com.spotprice.simulator.domain.service.engine.StochasticPriceEngine;
import com.spotprice.simulator.domain.service.regime.RegimeScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

@Slf4j
@Component
public class TimelineGenerator {

    private final StochasticPriceEngine priceEngine;
    private final SimulationProperties properties;
    private final Timer generationTimer;

    public TimelineGenerator(StochasticPriceEngine priceEngine,
                             SimulationProperties properties,
                             MeterRegistry meterRegistry) {
        this.priceEngine = priceEngine;
        this.properties = properties;
        this.generationTimer = Timer.builder("simulation.timeline.generation")
                .description("Full timeline generation duration")
                .register(meterRegistry);
    }

    public SimulationTimeline generate(SimulationParameters parameters, Long seed) {
        if (parameters == null) {
            throw new IllegalArgumentException("parameters must not be null");
        }

        long startNano = System.nanoTime();
        SimulationTimeline timeline;
        try {
            timeline = run(parameters, seed);
        } catch (RuntimeException e) {
            log.error("[Timeline] 생성 실패, 실행 중단: params={}, seed={}", parameters, seed, e);
            throw new TimelineGenerationException("타임라인 생성 실패: " + e.getMessage(), e);
        }
        long elapsedNanos = System.nanoTime() - startNano;
        generationTimer.record(Duration.ofNanos(elapsedNanos));

        TimelineStatistics stats = timeline.statistics();
        log.info("[Timeline] 생성 완료: points={}, segments={}, min={}, max={}, final={}, jumps={}, seed={}",
                stats.pointCount(), timeline.getSegments().size(),
                String.format("%.2f", stats.minPrice()),
                String.format("%.2f", stats.maxPrice()),
                String.format("%.2f", stats.finalPrice()),
                stats.jumpCount(), seed);
        log.debug("[Timeline] params={}, elapsed={}μs", parameters, elapsedNanos / 1_000);

        return timeline;
    }

    private SimulationTimeline run(SimulationParameters parameters, Long seed) {
        SplittableRandom random = seed != null ? new SplittableRandom(seed) : new SplittableRandom();
        double dt = properties.getTickSeconds();
        int totalTicks = properties.totalTicks();

        RegimeScheduler scheduler = new RegimeScheduler(properties.getRegimeSwitchIntervalSeconds());
        scheduler.initialize(random);

        List<PricePoint> points = new ArrayList<>(totalTicks);
        List<RegimeSegment> segments = new ArrayList<>();
        segments.add(new RegimeSegment(0, 0.0, scheduler.currentRegime()));

        double price = properties.getInitialPrice();
        for (int i = 0; i < totalTicks; i++) {
            double elapsed = i * dt;
            if (scheduler.advance(elapsed)) {
                segments.add(new RegimeSegment(i, scheduler.segmentStartTime(), scheduler.currentRegime()));
            }

            PricePoint point = priceEngine.step(elapsed, price, scheduler.currentRegime(), parameters, dt, random);
            ensureWithinBounds(point, i);
            points.add(point);
            price = point.price();
        }

        return new SimulationTimeline(parameters, seed, dt, properties.getInitialPrice(), points, segments);
    }

    private void ensureWithinBounds(PricePoint point, int index) {
        double price = point.price();
        // negated form also rejects NaN
        if (!(price >= StochasticPriceEngine.PRICE_FLOOR && price <= StochasticPriceEngine.PRICE_CEILING)) {
            throw new IllegalStateException(
                    "price out of bounds at tick " + index + ": " + price);
        }
    }
}
