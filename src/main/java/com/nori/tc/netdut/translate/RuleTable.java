package com.nori.tc.netdut.translate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 하나의 대상 dialect에 대한 순서 있는 번역 규칙 테이블. (불변)
 *
 * 확장은 상속이 아니라 조합으로 한다:
 * - defaults.prepend(overrides): overrides 규칙이 먼저 시도된다.
 * - defaults.append(extras): defaults에서 매칭되지 않은 줄만 extras로 넘어간다.
 */
public final class RuleTable {

    private static final RuleTable EMPTY = new RuleTable(List.of());

    private final List<TranslationRule> rules;

    private RuleTable(List<TranslationRule> rules) {
        this.rules = rules;
    }

    public static RuleTable empty() {
        return EMPTY;
    }

    public static RuleTable of(TranslationRule... rules) {
        return of(Arrays.asList(rules));
    }

    public static RuleTable of(List<TranslationRule> rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        return new RuleTable(List.copyOf(rules));
    }

    public static Builder builder() {
        return new Builder();
    }

    public RuleTable prepend(RuleTable first) {
        Objects.requireNonNull(first, "first must not be null");
        return concat(first, this);
    }

    public RuleTable append(RuleTable last) {
        Objects.requireNonNull(last, "last must not be null");
        return concat(this, last);
    }

    /**
     * 명령 줄 하나에 규칙을 적용한다. 매칭 규칙이 없으면 원문 그대로.
     */
    public String rewrite(String line) {
        Objects.requireNonNull(line, "line must not be null");
        return PatternMatcher.apply(line, rules);
    }

    public List<TranslationRule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    private static RuleTable concat(RuleTable a, RuleTable b) {
        List<TranslationRule> all = new ArrayList<>(a.rules.size() + b.rules.size());
        all.addAll(a.rules);
        all.addAll(b.rules);
        return new RuleTable(List.copyOf(all));
    }

    @Override
    public String toString() {
        return "RuleTable" + rules;
    }

    public static final class Builder {

        private final List<TranslationRule> rules = new ArrayList<>();

        private Builder() {
        }

        public Builder rule(String regex, String replacement) {
            rules.add(TranslationRule.of(regex, replacement));
            return this;
        }

        public Builder untranslatable(String regex) {
            rules.add(TranslationRule.untranslatable(regex));
            return this;
        }

        public Builder rules(RuleTable table) {
            rules.addAll(table.rules());
            return this;
        }

        public RuleTable build() {
            return new RuleTable(List.copyOf(rules));
        }
    }
}
