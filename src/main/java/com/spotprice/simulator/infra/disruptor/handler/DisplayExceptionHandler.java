package com.spotprice.simulator.infra.disruptor.handler;

import com.lmax.disruptor.ExceptionHandler;
import com.spotprice.simulator.infra.disruptor.event.PlaybackEvent;
import com.spotprice.simulator.infra.disruptor.event.PlaybackEventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;

@Slf4j
public class DisplayExceptionHandler implements ExceptionHandler<PlaybackEvent> {

    private final String pipelineName;
    private final Map<PlaybackEventType, Counter> counters = new EnumMap<>(PlaybackEventType.class);
    private final Counter untypedCounter;

    public DisplayExceptionHandler(String pipelineName, MeterRegistry meterRegistry) {
        this.pipelineName = pipelineName;
        for (PlaybackEventType type : PlaybackEventType.values()) {
            counters.put(type, exceptionCounter(meterRegistry, type.name()));
        }
        this.untypedCounter = exceptionCounter(meterRegistry, "UNKNOWN");
    }

    private Counter exceptionCounter(MeterRegistry meterRegistry, String eventType) {
        return Counter.builder("display.exceptions")
                .tag("pipeline", pipelineName)
                .tag("event", eventType)
                .description("Display sink failures, by playback event type")
                .register(meterRegistry);
    }

    @Override
    public void handleEventException(Throwable ex, long sequence, PlaybackEvent event) {
        PlaybackEventType type = event != null ? event.getType() : null;
        counters.getOrDefault(type, untypedCounter).increment();
        log.error("[Display-{}] 표시 처리 실패, 이벤트 드롭 (seq={}, type={}, event={})",
                pipelineName, sequence, type, event, ex);
    }

    @Override
    public void handleOnStartException(Throwable ex) {
        log.error("[Display-{}] 표시 핸들러 시작 실패", pipelineName, ex);
    }

    @Override
    public void handleOnShutdownException(Throwable ex) {
        log.error("[Display-{}] 표시 핸들러 종료 실패", pipelineName, ex);
    }
}
