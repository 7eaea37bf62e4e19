package com.spotprice.simulator.infra.display;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.spotprice.simulator.domain.model.PricePoint;
import com.spotprice.simulator.domain.model.VolatilityRegime;
import com.spotprice.simulator.domain.service.playback.PlaybackListener;
import com.spotprice.simulator.infra.disruptor.event.PlaybackEvent;
import com.spotprice.simulator.infra.disruptor.event.PlaybackEventFactory;
import com.spotprice.simulator.infra.disruptor.handler.DisplayEventHandler;
import com.spotprice.simulator.infra.disruptor.handler.DisplayExceptionHandler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DisruptorDisplayBridgeTest {

    private Disruptor<PlaybackEvent> disruptor;
    private DisruptorDisplayBridge bridge;
    private SlowSink sink;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        sink = new SlowSink();
        disruptor = new Disruptor<>(new PlaybackEventFactory(), 1024, Thread::new, ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.setDefaultExceptionHandler(new DisplayExceptionHandler("test", meterRegistry));
        disruptor.handleEventsWith(new DisplayEventHandler(sink));
        disruptor.start();
        bridge = new DisruptorDisplayBridge(disruptor.getRingBuffer(), meterRegistry);
    }

    @AfterEach
    void tearDown() {
        disruptor.halt();
    }

    @Test
    @DisplayName("Callbacks reach the sink in publish order on the display thread")
    void forwardsInOrder() throws Exception {
        Thread publisher = Thread.currentThread();

        bridge.onRegimeChange(VolatilityRegime.HIGH, 30.0);
        bridge.onPoint(new PricePoint(30.0, 120.0, VolatilityRegime.HIGH, true));
        bridge.onOverrun(Duration.ofMillis(3500), 151);
        bridge.onPoint(new PricePoint(30.2, 118.5, VolatilityRegime.HIGH, false));
        bridge.onComplete();

        assertThat(sink.terminal.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(sink.events).containsExactly(
                "regime:HIGH@30.0",
                "point:120.0:true",
                "overrun:151:3500",
                "point:118.5:false",
                "complete");
        assertThat(sink.threads).doesNotContain(publisher);
    }

    @Test
    @DisplayName("A slow sink does not hold up the publisher")
    void publisherIsNotBlockedBySlowSink() throws Exception {
        sink.delayMillis = 20;

        long start = System.nanoTime();
        for (int i = 0; i < 50; i++) {
            bridge.onPoint(new PricePoint(i * 0.2, 100.0, VolatilityRegime.LOW, false));
        }
        bridge.onCancelled();
        long publishMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(publishMillis).isLessThan(200);
        assertThat(sink.terminal.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(sink.events).hasSize(51).endsWith("cancelled");
    }

    @Test
    @DisplayName("A failing sink is counted and the pipeline keeps delivering")
    void sinkFailureIsIsolated() throws Exception {
        sink.failOnPrice = 101.0;

        bridge.onPoint(new PricePoint(0.0, 101.0, VolatilityRegime.LOW, false));
        bridge.onPoint(new PricePoint(0.2, 102.0, VolatilityRegime.LOW, false));
        bridge.onComplete();

        assertThat(sink.terminal.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(sink.events).containsExactly("point:102.0:false", "complete");
        assertThat(meterRegistry.find("display.exceptions").tag("event", "POINT").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A full ring buffer drops display points instead of blocking the publisher")
    void fullBufferDropsPoints() throws Exception {
        disruptor.halt();
        meterRegistry = new SimpleMeterRegistry();
        sink = new SlowSink();
        sink.gate = new CountDownLatch(1);
        disruptor = new Disruptor<>(new PlaybackEventFactory(), 4, Thread::new, ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.setDefaultExceptionHandler(new DisplayExceptionHandler("test", meterRegistry));
        disruptor.handleEventsWith(new DisplayEventHandler(sink));
        disruptor.start();
        bridge = new DisruptorDisplayBridge(disruptor.getRingBuffer(), meterRegistry);

        long start = System.nanoTime();
        for (int i = 0; i < 20; i++) {
            bridge.onPoint(new PricePoint(i * 0.2, 100.0 + i, VolatilityRegime.LOW, false));
        }
        long publishMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        sink.gate.countDown();
        bridge.onComplete();

        assertThat(publishMillis).isLessThan(200);
        assertThat(sink.terminal.await(5, TimeUnit.SECONDS)).isTrue();
        double dropped = meterRegistry.find("display.events.dropped").tag("event", "POINT").counter().count();
        assertThat(dropped).isGreaterThan(0.0);
        assertThat(sink.events).hasSize(20 - (int) dropped + 1).endsWith("complete");
        assertThat(sink.events.get(0)).isEqualTo("point:100.0:false");
    }

    private static class SlowSink implements PlaybackListener {

        final List<String> events = Collections.synchronizedList(new ArrayList<>());
        final List<Thread> threads = Collections.synchronizedList(new ArrayList<>());
        final CountDownLatch terminal = new CountDownLatch(1);
        volatile long delayMillis;
        volatile double failOnPrice = Double.NaN;
        volatile CountDownLatch gate;

        @Override
        public void onPoint(PricePoint point) {
            threads.add(Thread.currentThread());
            if (gate != null) {
                try {
                    gate.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (point.price() == failOnPrice) {
                throw new IllegalStateException("render failure");
            }
            if (delayMillis > 0) {
                try {
                    Thread.sleep(delayMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            events.add("point:" + point.price() + ":" + point.jumpOccurred());
        }

        @Override
        public void onRegimeChange(VolatilityRegime regime, double timestamp) {
            events.add("regime:" + regime + "@" + timestamp);
        }

        @Override
        public void onOverrun(Duration lag, int index) {
            events.add("overrun:" + index + ":" + lag.toMillis());
        }

        @Override
        public void onComplete() {
            events.add("complete");
            terminal.countDown();
        }

        @Override
        public void onCancelled() {
            events.add("cancelled");
            terminal.countDown();
        }
    }
}
