package com.nori.tc.netdut.capability;

import com.nori.tc.netdut.dialect.Dialect;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 테스트 실행 조건 팩토리.
 *
 * 패턴은 조건을 만드는 시점에 컴파일한다. 잘못된 패턴은 테스트 실행 전에 실패한다.
 */
public final class RunConditions {

    private RunConditions() {
        // utility class
    }

    /**
     * SKU가 패턴을 만족할 때만 실행한다.
     */
    public static RunCondition onlyDeviceType(String pattern) {
        return onlyDeviceType(pattern, null);
    }

    public static RunCondition onlyDeviceType(String pattern, String reason) {
        Predicate<String> matcher = CapabilityMatcher.compile(pattern);
        return device -> matcher.test(device.sku())
                ? RunDecision.run()
                : RunDecision.skip(withReason("Skipped on this SKU: " + device.sku()
                + " (only runs on " + pattern + ")", reason));
    }

    /**
     * SKU가 패턴을 만족하면 건너뛴다.
     */
    public static RunCondition skipDeviceType(String pattern) {
        return skipDeviceType(pattern, null);
    }

    public static RunCondition skipDeviceType(String pattern, String reason) {
        Predicate<String> matcher = CapabilityMatcher.compile(pattern);
        return device -> matcher.test(device.sku())
                ? RunDecision.skip(withReason("Skipped on this SKU: " + device.sku(), reason))
                : RunDecision.run();
    }

    /**
     * 허용된 dialect 중 하나일 때만 실행한다. (여러 dialect는 OR)
     */
    public static RunCondition onlyDialects(Dialect... dialects) {
        return onlyDialects(Arrays.asList(dialects));
    }

    public static RunCondition onlyDialects(Collection<Dialect> dialects) {
        if (dialects.isEmpty()) {
            throw new IllegalArgumentException("at least one dialect is required");
        }
        Set<Dialect> allowed = Set.copyOf(dialects);
        return device -> allowed.contains(device.dialect())
                ? RunDecision.run()
                : RunDecision.skip("cannot run on platform " + device.dialect());
    }

    /**
     * 모든 조건을 순서대로 평가하고 첫 skip 판정을 돌려준다. (AND)
     */
    public static RunCondition allOf(List<RunCondition> conditions) {
        List<RunCondition> copy = List.copyOf(conditions);
        return device -> {
            for (RunCondition c : copy) {
                RunDecision d = c.evaluate(device);
                if (d.shouldSkip()) {
                    return d;
                }
            }
            return RunDecision.run();
        };
    }

    private static String withReason(String message, String reason) {
        return (reason == null || reason.isBlank()) ? message : message + ": " + reason;
    }
}
