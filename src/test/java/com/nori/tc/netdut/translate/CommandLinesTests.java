package com.nori.tc.netdut.translate;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CommandLinesTests {

    @Test
    void splits_indented_block_and_drops_blank_lines() {
        String block = """
                configure
                  interface Ethernet10

                    l1 source interface Ethernet12
                end
                """;

        assertEquals(List.of("configure", "interface Ethernet10", "l1 source interface Ethernet12", "end"),
                CommandLines.split(block));
    }

    @Test
    void handles_crlf_and_cr() {
        assertEquals(List.of("a", "b", "c"), CommandLines.split("a\r\nb\rc"));
    }

    @Test
    void empty_block_gives_empty_list() {
        assertEquals(List.of(), CommandLines.split("  \n \n"));
    }
}
