package com.nori.tc.netdut.logging;

import java.util.Collection;
import java.util.Locale;

/**
 * StructuredLog
 *
 * 목적:
 * - 로그 메시지를 "event=... key=value" 한 줄 형태로 통일한다.
 * - 명령 목록(List 등)은 [a, b] 형태로 펼쳐서 하나의 값으로 기록한다.
 *
 * 규칙:
 * - 값에 공백/따옴표/백슬래시/= 가 있으면 "..."로 감싸고 escape 한다.
 * - key/value 짝이 맞지 않으면 마지막 key는 버린다.
 *
 * 예:
 * - StructuredLog.event("commands_translated", "dialect", "mos", "count", 2)
 *   -> event=commands_translated dialect=mos count=2
 */
public final class StructuredLog {

    private StructuredLog() {
        // utility class
    }

    public static String event(String event, Object... kv) {
        StringBuilder sb = new StringBuilder(128);
        append(sb, "event", event);
        for (int i = 0; i + 1 < kv.length; i += 2) {
            append(sb, String.valueOf(kv[i]), kv[i + 1]);
        }
        return sb.toString();
    }

    private static void append(StringBuilder sb, String key, Object value) {
        if (key == null || key.isBlank()) {
            return;
        }
        if (!sb.isEmpty()) {
            sb.append(' ');
        }
        sb.append(key).append('=').append(render(value));
    }

    static String render(Object value) {
        if (value == null) {
            return "null";
        }
        String s = (value instanceof Collection<?> c) ? renderCollection(c) : String.valueOf(value);
        return needsQuote(s) ? quote(s) : s;
    }

    private static String renderCollection(Collection<?> c) {
        StringBuilder out = new StringBuilder("[");
        boolean first = true;
        for (Object item : c) {
            if (!first) {
                out.append(", ");
            }
            out.append(item);
            first = false;
        }
        return out.append(']').toString();
    }

    private static boolean needsQuote(String s) {
        if (s.isEmpty()) {
            return true;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c) || c == '"' || c == '\\' || c == '=' || c < 0x20) {
                return true;
            }
        }
        return false;
    }

    private static String quote(String s) {
        StringBuilder out = new StringBuilder(s.length() + 8).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format(Locale.ROOT, "\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.append('"').toString();
    }
}
