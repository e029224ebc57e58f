package com.nori.tc.netdut.session;

import java.util.ArrayList;
import java.util.List;

/**
 * 장비와 명령을 주고받는 전송 경계.
 *
 * - 연결을 열고 관리하는 것은 구현체의 책임이다.
 * - 응답은 Map / List / scalar(String 포함) 로 이뤄진 원본 구조다. (번역 전)
 * - 전송 실패는 TransportException, 장비가 명령을 거부하면 CommandExecutionException.
 */
public interface CommandTransport extends AutoCloseable {

    /**
     * 명령 줄 1개를 실행하고 원본 응답을 돌려준다.
     */
    Object execute(String commandLine);

    /**
     * 명령 줄 여러 개를 순서대로 실행하고 줄마다 응답 1개씩, 같은 순서로 돌려준다.
     */
    default List<Object> executeAll(List<String> commandLines) {
        List<Object> out = new ArrayList<>(commandLines.size());
        for (String line : commandLines) {
            out.add(execute(line));
        }
        return out;
    }

    @Override
    default void close() {
        // nothing to release
    }
}
