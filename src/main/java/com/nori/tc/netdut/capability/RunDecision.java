package com.nori.tc.netdut.capability;

import java.util.Objects;

/**
 * 테스트 실행 판정 결과. skip이면 사유를 가진다.
 */
public final class RunDecision {

    private static final RunDecision RUN = new RunDecision(false, null);

    private final boolean skip;
    private final String reason;

    private RunDecision(boolean skip, String reason) {
        this.skip = skip;
        this.reason = reason;
    }

    public static RunDecision run() {
        return RUN;
    }

    public static RunDecision skip(String reason) {
        return new RunDecision(true, Objects.requireNonNull(reason, "reason must not be null"));
    }

    public boolean shouldSkip() {
        return skip;
    }

    /**
     * @return skip 사유. 실행 판정이면 null
     */
    public String reason() {
        return reason;
    }

    @Override
    public String toString() {
        return skip ? "SKIP(" + reason + ")" : "RUN";
    }
}
