package com.nori.tc.netdut.poll;

import com.nori.tc.netdut.logging.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Poller
 *
 * 장비 쪽 비동기 상태 변화를 기다린다. 조건 함수를 반복 호출해 참이 되거나 마감이 지나면 끝난다.
 *
 * 규칙:
 * - timeout이 0 이하여도 조건은 최소 1번 호출한다.
 * - 마감까지 참이 안 되면 false / Optional.empty()를 반환한다. (예외 아님)
 *   성공이 필요한 호출자는 결과를 직접 assert 한다.
 * - 조건 함수의 예외는 즉시 전파된다. awaitValue에 suppressed로 지정한 타입만 "실패 1회"로 취급한다.
 * - 호출 사이에는 Sleeper로 interval 만큼 멈춘다. 마지막 대기는 남은 시간까지만 잔다.
 * - 상태가 없으므로 여러 스레드가 한 인스턴스를 공유해도 된다.
 */
public final class Poller {

    private static final Logger log = LoggerFactory.getLogger(Poller.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(100);

    private final Duration defaultTimeout;
    private final Duration defaultInterval;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;

    public Poller() {
        this(DEFAULT_TIMEOUT, DEFAULT_INTERVAL);
    }

    public Poller(Duration defaultTimeout, Duration defaultInterval) {
        this(defaultTimeout, defaultInterval, Sleeper.THREAD, System::nanoTime);
    }

    public Poller(Duration defaultTimeout, Duration defaultInterval, Sleeper sleeper, LongSupplier nanoClock) {
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
        this.defaultInterval = requirePositive(defaultInterval);
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock must not be null");
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public Duration getDefaultInterval() {
        return defaultInterval;
    }

    public boolean waitFor(BooleanSupplier condition) {
        return waitFor(condition, defaultTimeout, defaultInterval);
    }

    public boolean waitFor(BooleanSupplier condition, Duration timeout) {
        return waitFor(condition, timeout, defaultInterval);
    }

    /**
     * @return 마감 전에 condition이 true를 반환했으면 true
     */
    public boolean waitFor(BooleanSupplier condition, Duration timeout, Duration interval) {
        Objects.requireNonNull(condition, "condition must not be null");
        return awaitValue(() -> condition.getAsBoolean() ? Boolean.TRUE : null, timeout, interval, Set.of())
                .isPresent();
    }

    public <T> Optional<T> awaitValue(Supplier<T> probe, Duration timeout, Duration interval) {
        return awaitValue(probe, timeout, interval, Set.of());
    }

    /**
     * probe가 null도 Boolean.FALSE도 아닌 값을 반환할 때까지 기다린다.
     *
     * @param suppressed 이 타입(하위 타입 포함)의 예외는 "아직 안 됨"으로 보고 계속 폴링한다
     * @return 처음 얻은 값. 마감까지 못 얻으면 Optional.empty()
     */
    public <T> Optional<T> awaitValue(Supplier<T> probe,
                                      Duration timeout,
                                      Duration interval,
                                      Set<Class<? extends RuntimeException>> suppressed) {
        Objects.requireNonNull(probe, "probe must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        requirePositive(interval);
        Objects.requireNonNull(suppressed, "suppressed must not be null");

        Deadline deadline = Deadline.after(timeout, nanoClock);
        int attempts = 0;

        while (true) {
            attempts++;
            T value = probeOnce(probe, suppressed, attempts);
            if (isTruthy(value)) {
                return Optional.of(value);
            }

            if (deadline.isExpired()) {
                log.debug(StructuredLog.event("wait_timed_out",
                        "timeoutMs", timeout.toMillis(),
                        "attempts", attempts,
                        "elapsedMs", deadline.elapsed().toMillis()));
                return Optional.empty();
            }

            Duration remaining = deadline.remaining();
            sleep(remaining.compareTo(interval) < 0 ? remaining : interval);
        }
    }

    private <T> T probeOnce(Supplier<T> probe, Set<Class<? extends RuntimeException>> suppressed, int attempt) {
        try {
            return probe.get();
        } catch (RuntimeException e) {
            if (!isSuppressed(e, suppressed)) {
                throw e;
            }
            log.debug(StructuredLog.event("wait_probe_failed",
                    "attempt", attempt,
                    "error", e.getClass().getSimpleName(),
                    "message", e.getMessage()));
            return null;
        }
    }

    private void sleep(Duration d) {
        if (d.isZero() || d.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(d);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PollInterruptedException("interrupted while polling", e);
        }
    }

    private static boolean isSuppressed(RuntimeException e, Set<Class<? extends RuntimeException>> suppressed) {
        for (Class<? extends RuntimeException> type : suppressed) {
            if (type.isInstance(e)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isTruthy(Object value) {
        return value != null && !Boolean.FALSE.equals(value);
    }

    private static Duration requirePositive(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        return interval;
    }
}
