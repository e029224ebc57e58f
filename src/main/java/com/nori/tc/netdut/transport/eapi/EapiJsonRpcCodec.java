package com.nori.tc.netdut.transport.eapi;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nori.tc.netdut.session.CommandExecutionException;
import com.nori.tc.netdut.session.TransportException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * EapiJsonRpcCodec
 *
 * eAPI "runCmds" JSON-RPC 2.0 요청/응답 변환.
 *
 * 요청:
 * {"jsonrpc":"2.0","method":"runCmds","params":{"version":1,"cmds":[...],"format":"json"},"id":"1"}
 *
 * 응답:
 * - "result": 명령마다 결과 1개 (Map)
 * - "error": {"code":..,"message":..,"data":[...]} 이면 data에서 "errors"가 있는 첫 항목의 명령을 실패 명령으로 본다.
 */
public final class EapiJsonRpcCodec {

    private static final TypeReference<Map<String, Object>> REPLY_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final AtomicLong ids = new AtomicLong();

    public EapiJsonRpcCodec() {
        this(new ObjectMapper());
    }

    public EapiJsonRpcCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public byte[] encodeRunCmds(List<String> commands) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("version", 1);
        params.put("cmds", List.copyOf(commands));
        params.put("format", "json");

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("method", "runCmds");
        request.put("params", params);
        request.put("id", String.valueOf(ids.incrementAndGet()));

        try {
            return mapper.writeValueAsBytes(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to encode eAPI request", e);
        }
    }

    /**
     * @param body     HTTP 응답 본문
     * @param commands 요청에 보낸 명령 목록 (실패 명령 식별용)
     * @return 명령 순서대로 결과
     * @throws CommandExecutionException 장비가 error로 응답한 경우
     * @throws TransportException        본문이 JSON-RPC 응답 형태가 아닌 경우
     */
    public List<Object> decodeReply(byte[] body, List<String> commands) {
        Map<String, Object> reply;
        try {
            reply = mapper.readValue(body, REPLY_TYPE);
        } catch (IOException e) {
            throw new TransportException("malformed eAPI reply", e);
        }
        if (reply == null) {
            throw new TransportException("empty eAPI reply");
        }

        if (reply.get("error") instanceof Map<?, ?> error) {
            throw toCommandError(error, commands);
        }

        if (!(reply.get("result") instanceof List<?> result)) {
            throw new TransportException("eAPI reply has no result list");
        }
        if (result.size() != commands.size()) {
            throw new TransportException("eAPI returned " + result.size() + " results for " + commands.size() + " commands");
        }
        return new ArrayList<>(result);
    }

    static CommandExecutionException toCommandError(Map<?, ?> error, List<String> commands) {
        int code = (error.get("code") instanceof Number n) ? n.intValue() : -1;
        String message = String.valueOf(error.get("message"));

        String failed = null;
        List<String> deviceErrors = new ArrayList<>();
        if (error.get("data") instanceof List<?> data) {
            for (int i = 0; i < data.size(); i++) {
                if (data.get(i) instanceof Map<?, ?> entry && entry.get("errors") instanceof List<?> errs) {
                    failed = i < commands.size() ? commands.get(i) : null;
                    for (Object e : errs) {
                        deviceErrors.add(String.valueOf(e));
                    }
                    break;
                }
            }
        }
        return new CommandExecutionException(code, message, failed, deviceErrors);
    }
}
