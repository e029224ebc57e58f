package com.nori.tc.netdut.transport.eapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nori.tc.netdut.session.CommandExecutionException;
import com.nori.tc.netdut.session.TransportException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * runCmds JSON-RPC 요청/응답 변환 테스트
 */
class EapiJsonRpcCodecTests {

    private final EapiJsonRpcCodec codec = new EapiJsonRpcCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    private static byte[] json(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void encodes_run_cmds_request() throws Exception {
        JsonNode first = mapper.readTree(codec.encodeRunCmds(List.of("enable", "show version")));
        JsonNode second = mapper.readTree(codec.encodeRunCmds(List.of("show clock")));

        assertEquals("2.0", first.get("jsonrpc").asText());
        assertEquals("runCmds", first.get("method").asText());
        assertEquals(1, first.get("params").get("version").asInt());
        assertEquals("json", first.get("params").get("format").asText());
        assertEquals("show version", first.get("params").get("cmds").get(1).asText());
        assertNotEquals(first.get("id").asText(), second.get("id").asText());
    }

    @Test
    void decodes_results_in_command_order() {
        List<Object> out = codec.decodeReply(
                json("{\"jsonrpc\":\"2.0\",\"id\":\"1\",\"result\":[{},{\"modelName\":\"DCS-7130\",\"memTotal\":100}]}"),
                List.of("enable", "show version"));

        assertEquals(2, out.size());
        assertEquals(Map.of("modelName", "DCS-7130", "memTotal", 100), out.get(1));
    }

    @Test
    void error_reply_names_failed_command() {
        byte[] body = json("""
                {"jsonrpc":"2.0","id":"1","error":{"code":1002,
                 "message":"CLI command 2 of 2 'show bogus' failed: invalid command",
                 "data":[{},{"errors":["Invalid input (at token 1: 'bogus')"]}]}}
                """);

        CommandExecutionException e = assertThrows(CommandExecutionException.class,
                () -> codec.decodeReply(body, List.of("enable", "show bogus")));

        assertEquals(1002, e.getCode());
        assertEquals("show bogus", e.getFailedCommand());
        assertEquals(List.of("Invalid input (at token 1: 'bogus')"), e.getDeviceErrors());
    }

    @Test
    void error_without_data_has_no_failed_command() {
        CommandExecutionException e = assertThrows(CommandExecutionException.class,
                () -> codec.decodeReply(json("{\"error\":{\"code\":-32600,\"message\":\"Invalid request\"}}"),
                        List.of("show version")));

        assertEquals(-32600, e.getCode());
        assertNull(e.getFailedCommand());
        assertEquals(List.of(), e.getDeviceErrors());
    }

    @Test
    void malformed_or_mismatched_reply_is_transport_error() {
        assertThrows(TransportException.class, () -> codec.decodeReply(json("<html>"), List.of("show version")));
        assertThrows(TransportException.class, () -> codec.decodeReply(json("{\"result\":{}}"), List.of("show version")));
        assertThrows(TransportException.class, () -> codec.decodeReply(json("{\"result\":[{}]}"), List.of("a", "b")));
    }
}
