package com.nori.tc.netdut.translate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 규칙 테이블 조합 테스트 (prepend / append)
 */
class RuleTableTests {

    private final RuleTable defaults = RuleTable.builder()
            .rule("l1 source interface (.*)", "source \\1")
            .build();

    @Test
    void prepended_rules_are_tried_first() {
        RuleTable overrides = RuleTable.builder().rule("l1 source interface Ethernet1", "source front1").build();

        RuleTable table = defaults.prepend(overrides);

        assertEquals(2, table.size());
        assertEquals("source front1", table.rewrite("l1 source interface Ethernet1"));
        assertEquals("source Ethernet2", table.rewrite("l1 source interface Ethernet2"));
    }

    @Test
    void appended_rules_only_see_unmatched_lines() {
        RuleTable extras = RuleTable.builder()
                .rule("l1 source interface (.*)", "never \\1")
                .rule("show hardware", "show platform")
                .build();

        RuleTable table = defaults.append(extras);

        assertEquals("source Ethernet2", table.rewrite("l1 source interface Ethernet2"));
        assertEquals("show platform", table.rewrite("show hardware"));
    }

    @Test
    void composition_does_not_change_originals() {
        defaults.append(RuleTable.builder().rule("a", "b").build());
        assertEquals(1, defaults.size());
    }

    @Test
    void empty_table_passes_everything_through() {
        assertTrue(RuleTable.empty().isEmpty());
        assertEquals("anything", RuleTable.empty().rewrite("anything"));
        assertSame(RuleTable.empty(), RuleTable.empty());
    }

    @Test
    void rules_list_is_unmodifiable() {
        assertThrows(UnsupportedOperationException.class,
                () -> defaults.rules().add(TranslationRule.of("x", "y")));
    }
}
