package com.nori.tc.netdut.translate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * camelCase -> snake_case 변환 테스트
 *
 * - '/' 구간마다 첫 글자 대문자는 '_' 없이 소문자로
 * - 이미 snake_case인 키는 그대로 (멱등)
 */
class KeyTransformsTests {

    private final KeyTransform snake = KeyTransforms.camelToSnake();

    @Test
    void converts_camel_case() {
        assertEquals("model_name", snake.apply("modelName"));
        assertEquals("start_time", snake.apply("startTime"));
        assertEquals("system_mac_address", snake.apply("systemMacAddress"));
    }

    @Test
    void segment_leading_capital_gets_no_underscore() {
        assertEquals("ethernet1/link_status", snake.apply("Ethernet1/linkStatus"));
        assertEquals("ap1/rx_bytes", snake.apply("ap1/rxBytes"));
    }

    @Test
    void is_idempotent() {
        for (String key : new String[]{"modelName", "model_name", "Ethernet1/linkStatus", "daemons", "x"}) {
            String once = snake.apply(key);
            assertEquals(once, snake.apply(once), key);
        }
    }

    @Test
    void identity_keeps_key() {
        assertEquals("modelName", KeyTransforms.identity().apply("modelName"));
    }
}
