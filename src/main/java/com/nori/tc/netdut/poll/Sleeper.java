package com.nori.tc.netdut.poll;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 폴링 간격 동안 호출 스레드를 멈춘다. (busy-spin 금지)
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> TimeUnit.NANOSECONDS.sleep(d.toNanos());

    void sleep(Duration duration) throws InterruptedException;
}
