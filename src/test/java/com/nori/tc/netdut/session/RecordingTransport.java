package com.nori.tc.netdut.session;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 보낸 명령 줄을 기록하고, 등록된 응답(없으면 빈 Map)을 돌려주는 테스트용 전송.
 */
class RecordingTransport implements CommandTransport {

    final List<String> sent = new ArrayList<>();
    final Map<String, Object> replies = new LinkedHashMap<>();
    Function<String, Object> fallback = line -> Map.of();
    int closeCount = 0;

    RecordingTransport reply(String line, Object reply) {
        replies.put(line, reply);
        return this;
    }

    @Override
    public Object execute(String commandLine) {
        sent.add(commandLine);
        Object r = replies.get(commandLine);
        return r != null ? r : fallback.apply(commandLine);
    }

    @Override
    public void close() {
        closeCount++;
    }
}
