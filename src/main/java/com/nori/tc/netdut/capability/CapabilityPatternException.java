package com.nori.tc.netdut.capability;

/**
 * 장비 식별 패턴(정규식)이 잘못된 경우. 조건을 만드는 시점에 발생한다.
 */
public class CapabilityPatternException extends IllegalArgumentException {

    public CapabilityPatternException(String pattern, Throwable cause) {
        super("invalid device pattern: " + pattern, cause);
    }
}
