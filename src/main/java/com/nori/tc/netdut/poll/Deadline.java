package com.nori.tc.netdut.poll;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * 단일 대기 호출의 마감 시각. (시작 시각 + timeout, 단조 시계 기준)
 *
 * timeout이 0 또는 음수면 생성 즉시 만료 상태다.
 */
public final class Deadline {

    private final LongSupplier nanoClock;
    private final long startNanos;
    private final long timeoutNanos;

    private Deadline(LongSupplier nanoClock, Duration timeout) {
        this.nanoClock = nanoClock;
        this.startNanos = nanoClock.getAsLong();
        this.timeoutNanos = Math.max(0L, saturatedNanos(timeout));
    }

    public static Deadline after(Duration timeout) {
        return after(timeout, System::nanoTime);
    }

    public static Deadline after(Duration timeout, LongSupplier nanoClock) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(nanoClock, "nanoClock must not be null");
        return new Deadline(nanoClock, timeout);
    }

    public boolean isExpired() {
        return elapsedNanos() >= timeoutNanos;
    }

    /**
     * @return 남은 시간. 만료됐으면 Duration.ZERO
     */
    public Duration remaining() {
        return Duration.ofNanos(Math.max(0L, timeoutNanos - elapsedNanos()));
    }

    public Duration elapsed() {
        return Duration.ofNanos(elapsedNanos());
    }

    private long elapsedNanos() {
        return nanoClock.getAsLong() - startNanos;
    }

    private static long saturatedNanos(Duration d) {
        try {
            return d.toNanos();
        } catch (ArithmeticException e) {
            return d.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }
}
