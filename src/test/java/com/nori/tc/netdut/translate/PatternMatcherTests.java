package com.nori.tc.netdut.translate;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * first-match-wins / pass-through 테스트
 */
class PatternMatcherTests {

    @Test
    void first_matching_rule_wins() {
        List<TranslationRule> rules = List.of(
                TranslationRule.of("l1 source interface ap1/(.*)", "source ap\\1"),
                TranslationRule.of("l1 source interface (.*)", "source \\1"));

        assertEquals("source ap3", PatternMatcher.apply("l1 source interface ap1/3", rules));
        assertEquals("source Ethernet3", PatternMatcher.apply("l1 source interface Ethernet3", rules));
    }

    @Test
    void earlier_general_rule_shadows_later_specific_rule() {
        List<TranslationRule> rules = List.of(
                TranslationRule.of("l1 source interface (.*)", "source \\1"),
                TranslationRule.of("l1 source interface ap1/(.*)", "source ap\\1"));

        assertEquals("source ap1/3", PatternMatcher.apply("l1 source interface ap1/3", rules));
    }

    @Test
    void unmatched_line_passes_through() {
        List<TranslationRule> rules = List.of(TranslationRule.of("no l1 source", "no source"));
        assertEquals("show version", PatternMatcher.apply("show version", rules));
        assertEquals("show version", PatternMatcher.apply("show version", List.of()));
    }
}
