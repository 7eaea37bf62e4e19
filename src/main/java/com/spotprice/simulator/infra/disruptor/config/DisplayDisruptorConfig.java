package com.spotprice.simulator.infra.disruptor.config;

import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.spotprice.simulator.common.DaemonThreads;
import com.spotprice.simulator.infra.disruptor.event.PlaybackEvent;
import com.spotprice.simulator.infra.disruptor.event.PlaybackEventFactory;
import com.spotprice.simulator.infra.disruptor.handler.DisplayEventHandler;
import com.spotprice.simulator.infra.disruptor.handler.DisplayExceptionHandler;
import com.spotprice.simulator.infra.display.LoggingDisplaySink;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.Arrays;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class DisplayDisruptorConfig {

    private final LoggingDisplaySink loggingDisplaySink;
    private final DisplayProperties properties;
    private final MeterRegistry meterRegistry;
    private final Environment environment;

    private Disruptor<PlaybackEvent> displayDisruptor;

    @Bean
    public Disruptor<PlaybackEvent> playbackDisplayDisruptor() {
        WaitStrategy waitStrategy = resolveWaitStrategy();
        int bufferSize = ceilingPowerOfTwo(properties.getBufferSize());

        displayDisruptor = new Disruptor<>(
                new PlaybackEventFactory(),
                bufferSize,
                DaemonThreads.named("disruptor-display"),
                ProducerType.MULTI,
                waitStrategy
        );

        displayDisruptor.setDefaultExceptionHandler(
                new DisplayExceptionHandler("display", meterRegistry));

        displayDisruptor.handleEventsWith(new DisplayEventHandler(loggingDisplaySink));
        displayDisruptor.start();

        RingBuffer<PlaybackEvent> ringBuffer = displayDisruptor.getRingBuffer();
        Gauge.builder("display.ringbuffer.remaining", ringBuffer, rb -> (double) rb.remainingCapacity())
                .description("Display RingBuffer remaining capacity")
                .register(meterRegistry);

        log.info("[Disruptor] Display 파이프라인 기동: Playback → Display | size={}, wait={}",
                bufferSize, waitStrategy.getClass().getSimpleName());

        return displayDisruptor;
    }

    @Bean
    public RingBuffer<PlaybackEvent> displayRingBuffer(Disruptor<PlaybackEvent> playbackDisplayDisruptor) {
        return playbackDisplayDisruptor.getRingBuffer();
    }

    @PreDestroy
    public void shutdown() {
        if (displayDisruptor == null) {
            return;
        }
        long pending = displayDisruptor.getRingBuffer().getBufferSize()
                - displayDisruptor.getRingBuffer().remainingCapacity();
        log.info("[Disruptor] Display 파이프라인 종료: 미처리 이벤트={}", pending);
        displayDisruptor.shutdown();
    }

    private WaitStrategy resolveWaitStrategy() {
        boolean prod = Arrays.asList(environment.getActiveProfiles()).contains("prod");
        WaitStrategy strategy = prod ? new YieldingWaitStrategy() : new SleepingWaitStrategy();
        log.debug("[Disruptor] Display 대기 전략 선택: prod={}, strategy={}",
                prod, strategy.getClass().getSimpleName());
        return strategy;
    }

    private static int ceilingPowerOfTwo(int value) {
        if (value <= 1) return 1;
        return Integer.highestOneBit(value - 1) << 1;
    }
}
