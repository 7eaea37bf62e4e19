package com.spotprice.simulator.infra.display;

import com.spotprice.simulator.domain.model.PricePoint;
import com.spotprice.simulator.domain.model.VolatilityRegime;
import com.spotprice.simulator.domain.service.playback.PlaybackListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Component
public class LoggingDisplaySink implements PlaybackListener {

    private final AtomicInteger received = new AtomicInteger(0);

    @Override
    public void onPoint(PricePoint point) {
        received.incrementAndGet();
        if (point.jumpOccurred()) {
            log.info("[Display] 점프 발생: t={}s, price={} EUR, regime={}",
                    String.format("%.1f", point.timestamp()),
                    String.format("%.2f", point.price()), point.regime());
        } else {
            log.debug("[Display] t={}s, price={} EUR, regime={}",
                    String.format("%.1f", point.timestamp()),
                    String.format("%.2f", point.price()), point.regime());
        }
    }

    @Override
    public void onRegimeChange(VolatilityRegime regime, double timestamp) {
        log.info("[Display] 레짐: {} (t={}s, vol x{}, jump x{})", regime,
                String.format("%.1f", timestamp),
                regime.getVolatilityMultiplier(), regime.getJumpProbabilityMultiplier());
    }

    @Override
    public void onOverrun(Duration lag, int index) {
        log.warn("[Display] 재생 지연 경고: index={}, lag={}ms", index, lag.toMillis());
    }

    @Override
    public void onComplete() {
        log.info("[Display] 재생 완료: received={}", received.getAndSet(0));
    }

    @Override
    public void onCancelled() {
        log.info("[Display] 재생 취소: received={}", received.getAndSet(0));
    }
}
