package com.nori.tc.netdut.capability;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 장비 식별 문자열(SKU/모델)이 정규식을 만족하는지 판정한다.
 *
 * 매칭 방식:
 * - search 방식(Matcher.find): 식별자 어디에서든 매칭되면 true.
 *   "DCS-7130.*"는 사실상 "DCS-7130을 포함"을 뜻한다.
 * - 시작 고정이 필요하면 패턴에 "^"를 쓴다.
 */
public final class CapabilityMatcher {

    private CapabilityMatcher() {
        // utility class
    }

    public static boolean matches(String identifier, String pattern) {
        return compile(pattern).test(identifier);
    }

    /**
     * @throws CapabilityPatternException 정규식 오류
     */
    public static Predicate<String> compile(String pattern) {
        Pattern p = compilePattern(pattern);
        return identifier -> identifier != null && p.matcher(identifier).find();
    }

    static Pattern compilePattern(String pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new CapabilityPatternException(pattern, e);
        }
    }
}
