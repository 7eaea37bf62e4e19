package com.spotprice.simulator.domain.service.playback;

import com.spotprice.simulator.domain.model.PlaybackSnapshot;
import com.spotprice.simulator.domain.model.PlaybackState;
import com.spotprice.simulator.domain.model.PricePoint;
import com.spotprice.simulator.domain.model.SimulationTimeline;
import com.spotprice.simulator.domain.model.VolatilityRegime;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Replays a precomputed timeline at a fixed wall-clock cadence on its own thread.
 * <p>
 * Point {@code i} is due at {@code anchor + i * tick}. The anchor is set when playback starts and
 * again on every resume, so a slow callback only shortens the following waits and never shifts
 * later deadlines. Points are never skipped or reordered. Completion is signalled at
 * {@code anchor + size * tick}.
 * <p>
 * {@link #stop()} does not interrupt a running callback. The run ends as CANCELLED once the
 * in-flight callback returns.
 */
@Slf4j
public class PlaybackController {

    private final SimulationTimeline timeline;
    private final PlaybackListener listener;
    private final long tickNanos;
    private final long overrunThresholdNanos;
    private final int overrunWarningTicks;
    private final ThreadFactory threadFactory;

    private final Counter emittedCounter;
    private final Counter overrunCounter;
    private final Counter callbackFailureCounter;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeUp = lock.newCondition();
    private final CountDownLatch terminated = new CountDownLatch(1);

    // guarded by lock
    private volatile PlaybackState state = PlaybackState.IDLE;
    private boolean stopRequested;
    private boolean anchored;
    private long anchorNanos;

    // playback thread only
    private long lagNanos;
    private int laggingTicks;

    private volatile PricePoint lastEmitted;
    private volatile int emittedCount;
    private volatile int jumpCount;

    public PlaybackController(SimulationTimeline timeline,
                              PlaybackListener listener,
                              PlaybackProperties properties,
                              MeterRegistry meterRegistry,
                              ThreadFactory threadFactory) {
        if (timeline == null || listener == null) {
            throw new IllegalArgumentException("timeline and listener must not be null");
        }
        if (properties.getTickInterval().isZero() || properties.getTickInterval().isNegative()) {
            throw new IllegalArgumentException("tickInterval은 양수여야 합니다");
        }
        this.timeline = timeline;
        this.listener = listener;
        this.tickNanos = properties.getTickInterval().toNanos();
        this.overrunThresholdNanos = properties.getOverrunThreshold().toNanos();
        this.overrunWarningTicks = Math.max(1, properties.getOverrunWarningTicks());
        this.threadFactory = threadFactory;

        this.emittedCounter = Counter.builder("playback.points.emitted")
                .description("Price points delivered to playback listeners")
                .register(meterRegistry);
        this.overrunCounter = Counter.builder("playback.overrun.warnings")
                .description("Sustained schedule overruns reported to listeners")
                .register(meterRegistry);
        this.callbackFailureCounter = Counter.builder("playback.callback.failures")
                .description("Listener callbacks that threw")
                .register(meterRegistry);
    }

    public void play() {
        lock.lock();
        try {
            if (state != PlaybackState.IDLE) {
                throw new IllegalStateException("play()는 IDLE 상태에서만 호출할 수 있습니다: state=" + state);
            }
            state = PlaybackState.RUNNING;
            anchorNanos = System.nanoTime();
            anchored = true;
            threadFactory.newThread(this::runLoop).start();
        } finally {
            lock.unlock();
        }
        log.info("[Playback] 재생 시작: points={}, tick={}ms, seed={}",
                timeline.size(), TimeUnit.NANOSECONDS.toMillis(tickNanos), timeline.getSeed());
    }

    public boolean pause() {
        lock.lock();
        try {
            if (state != PlaybackState.RUNNING || stopRequested) {
                return false;
            }
            state = PlaybackState.PAUSED;
            anchored = false;
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("[Playback] 일시정지: emitted={}/{}", emittedCount, timeline.size());
        return true;
    }

    public boolean resume() {
        lock.lock();
        try {
            if (state != PlaybackState.PAUSED || stopRequested) {
                return false;
            }
            state = PlaybackState.RUNNING;
            anchored = false;
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("[Playback] 재개: next={}/{}", emittedCount, timeline.size());
        return true;
    }

    public boolean stop() {
        boolean cancelledFromIdle;
        lock.lock();
        try {
            if (state.isTerminal() || stopRequested) {
                return false;
            }
            stopRequested = true;
            cancelledFromIdle = state == PlaybackState.IDLE;
            if (cancelledFromIdle) {
                state = PlaybackState.CANCELLED;
            }
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }

        if (cancelledFromIdle) {
            log.info("[Playback] 재생 전 취소");
            deliver("onCancelled", listener::onCancelled);
            terminated.countDown();
        } else {
            log.info("[Playback] 중지 요청: emitted={}/{}", emittedCount, timeline.size());
        }
        return true;
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public PlaybackState getState() {
        return state;
    }

    public SimulationTimeline getTimeline() {
        return timeline;
    }

    public PlaybackSnapshot snapshot() {
        PricePoint last = lastEmitted;
        int emitted = emittedCount;
        return PlaybackSnapshot.builder()
                .state(state)
                .emittedCount(emitted)
                .totalPoints(timeline.size())
                .currentPrice(last != null ? last.price() : timeline.getInitialPrice())
                .elapsedSeconds(emitted * timeline.getTickSeconds())
                .regime(last != null ? last.regime() : initialRegime())
                .jumpCount(jumpCount)
                .build();
    }

    private void runLoop() {
        boolean completed = false;
        try {
            int total = timeline.size();
            for (int i = 0; i < total; i++) {
                if (!awaitDeadline(i)) {
                    return;
                }
                emit(i);
            }
            completed = awaitDeadline(total);
        } catch (RuntimeException e) {
            log.error("[Playback] 재생 루프 예외, 실행 취소", e);
        } finally {
            finish(completed);
        }
    }

    private boolean awaitDeadline(int index) {
        lock.lock();
        try {
            while (!stopRequested) {
                if (state == PlaybackState.PAUSED) {
                    wakeUp.await();
                    continue;
                }

                long now = System.nanoTime();
                if (!anchored) {
                    anchorNanos = now + tickNanos - (long) index * tickNanos;
                    anchored = true;
                }

                long remaining = anchorNanos + (long) index * tickNanos - now;
                if (remaining <= 0) {
                    lagNanos = -remaining;
                    return true;
                }
                wakeUp.awaitNanos(remaining);
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Playback] 재생 스레드 인터럽트, 중지 처리: index={}", index);
            stopRequested = true;
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void emit(int index) {
        PricePoint point = timeline.get(index);
        trackOverrun(index);

        timeline.segmentStartingAt(index).ifPresent(segment -> {
            log.info("[Playback] 레짐 구간 시작: index={}, t={}s, regime={}",
                    index, segment.startTime(), segment.regime());
            deliver("onRegimeChange", () -> listener.onRegimeChange(segment.regime(), segment.startTime()));
        });

        deliver("onPoint", () -> listener.onPoint(point));

        lastEmitted = point;
        if (point.jumpOccurred()) {
            jumpCount++;
        }
        emittedCount = index + 1;
        emittedCounter.increment();
    }

    private void trackOverrun(int index) {
        if (lagNanos <= overrunThresholdNanos) {
            laggingTicks = 0;
            return;
        }
        laggingTicks++;
        if (laggingTicks == overrunWarningTicks) {
            Duration lag = Duration.ofNanos(lagNanos);
            overrunCounter.increment();
            log.warn("[Playback] 스케줄 지연 지속: index={}, lag={}ms, 모든 포인트는 계속 전달됨",
                    index, lag.toMillis());
            deliver("onOverrun", () -> listener.onOverrun(lag, index));
        }
    }

    private void finish(boolean completed) {
        PlaybackState finalState;
        lock.lock();
        try {
            finalState = completed && !stopRequested ? PlaybackState.COMPLETED : PlaybackState.CANCELLED;
            state = finalState;
        } finally {
            lock.unlock();
        }

        log.info("[Playback] 종료: state={}, emitted={}/{}, jumps={}",
                finalState, emittedCount, timeline.size(), jumpCount);
        if (finalState == PlaybackState.COMPLETED) {
            deliver("onComplete", listener::onComplete);
        } else {
            deliver("onCancelled", listener::onCancelled);
        }
        terminated.countDown();
    }

    private void deliver(String callback, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            callbackFailureCounter.increment();
            log.error("[Playback] 리스너 콜백 예외 ({}), 재생은 계속 진행", callback, e);
        }
    }

    private VolatilityRegime initialRegime() {
        return timeline.getSegments().isEmpty() ? null : timeline.getSegments().get(0).regime();
    }
}
