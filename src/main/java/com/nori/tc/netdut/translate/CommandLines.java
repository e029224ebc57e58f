package com.nori.tc.netdut.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 여러 줄 명령 문자열을 명령 줄 목록으로 나눈다.
 *
 * - 줄바꿈(\n, \r\n, \r) 기준으로 나누고 각 줄의 앞뒤 공백을 제거한다.
 * - 빈 줄은 버린다. (들여쓰기한 config 블록을 그대로 쓸 수 있게)
 */
public final class CommandLines {

    private CommandLines() {
        // utility class
    }

    public static List<String> split(String block) {
        Objects.requireNonNull(block, "block must not be null");
        List<String> out = new ArrayList<>();
        for (String line : block.split("\\R")) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return List.copyOf(out);
    }
}
