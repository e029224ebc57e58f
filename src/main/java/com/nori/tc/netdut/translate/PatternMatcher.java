package com.nori.tc.netdut.translate;

import java.util.List;

/**
 * 순서가 있는 규칙 목록에서 "처음" 매칭되는 규칙을 적용한다. (first-match-wins)
 *
 * - 가장 긴 매칭/가장 구체적인 규칙을 고르지 않는다. 규칙 순서가 곧 우선순위다.
 * - 어떤 규칙도 매칭되지 않으면 입력을 그대로 돌려준다.
 */
public final class PatternMatcher {

    private PatternMatcher() {
        // utility class
    }

    public static String apply(String candidate, List<TranslationRule> rules) {
        for (TranslationRule rule : rules) {
            String rewritten = rule.rewrite(candidate);
            if (rewritten != null) {
                return rewritten;
            }
        }
        return candidate;
    }
}
