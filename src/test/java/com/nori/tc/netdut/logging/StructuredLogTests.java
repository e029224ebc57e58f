package com.nori.tc.netdut.logging;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * StructuredLog 한 줄 포맷 테스트
 */
class StructuredLogTests {

    @Test
    void renders_event_and_plain_pairs() {
        assertEquals("event=commands_translated dialect=mos count=2",
                StructuredLog.event("commands_translated", "dialect", "mos", "count", 2));
    }

    @Test
    void quotes_values_with_spaces_and_escapes_quotes() {
        assertEquals("event=x cmd=\"show version\"", StructuredLog.event("x", "cmd", "show version"));
        assertEquals("\"a\\\"b\"", StructuredLog.render("a\"b"));
        assertEquals("\"\"", StructuredLog.render(""));
        assertEquals("\"line1\\nline2\"", StructuredLog.render("line1\nline2"));
    }

    @Test
    void renders_collections_as_single_value() {
        assertEquals("event=send commands=\"[interface Ethernet10, source Ethernet12]\"",
                StructuredLog.event("send", "commands", List.of("interface Ethernet10", "source Ethernet12")));
        assertEquals("[a]", StructuredLog.render(List.of("a")));
    }

    @Test
    void drops_dangling_key_and_renders_null() {
        assertEquals("event=x a=null", StructuredLog.event("x", "a", null, "dangling"));
    }
}
