package com.nori.tc.netdut.capability;

import java.util.List;

/**
 * 장비 정보로 테스트 실행 여부를 정하는 조건.
 * 여러 조건은 and()로 묶는다. (하나라도 skip이면 skip)
 */
@FunctionalInterface
public interface RunCondition {

    RunDecision evaluate(DeviceIdentity device);

    default RunCondition and(RunCondition other) {
        return RunConditions.allOf(List.of(this, other));
    }
}
