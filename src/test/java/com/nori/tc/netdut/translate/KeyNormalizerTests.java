package com.nori.tc.netdut.translate;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * 중첩 응답 키 변환 테스트
 *
 * - mapping 키만 바뀌고 값/리스트 원소/순서는 그대로
 * - 같은 mapping 안의 키 충돌은 경로와 함께 실패
 */
class KeyNormalizerTests {

    private final KeyNormalizer normalizer = new KeyNormalizer(KeyTransforms.camelToSnake());

    @Test
    void rewrites_nested_keys_and_keeps_values() {
        Map<String, Object> sleeper = Map.of("startTime", 0.0);
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("modelName", "DCS-7130");
        reply.put("daemons", Map.of("sleeper", sleeper));

        Object out = normalizer.normalize(reply);

        assertEquals(Map.of("model_name", "DCS-7130", "daemons", Map.of("sleeper", Map.of("start_time", 0.0))), out);
    }

    @Test
    void keeps_key_order() {
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("zetaValue", 1);
        reply.put("alphaValue", 2);
        reply.put("midValue", 3);

        @SuppressWarnings("unchecked")
        Map<String, Object> out = (Map<String, Object>) normalizer.normalize(reply);

        assertEquals(List.of("zeta_value", "alpha_value", "mid_value"), new ArrayList<>(out.keySet()));
    }

    @Test
    void recurses_into_lists_without_touching_string_elements() {
        Object reply = List.of(Map.of("portName", "Ethernet1"), "camelString", List.of(Map.of("rxBytes", 10)));

        Object out = normalizer.normalize(reply);

        assertEquals(List.of(Map.of("port_name", "Ethernet1"), "camelString", List.of(Map.of("rx_bytes", 10))), out);
    }

    @Test
    void scalar_is_returned_as_is() {
        assertEquals("modelName", normalizer.normalize("modelName"));
        assertEquals(42, normalizer.normalize(42));
        assertNull(normalizer.normalize(null));
    }

    @Test
    void does_not_modify_input() {
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("modelName", "DCS-7130");

        normalizer.normalize(reply);

        assertEquals(Map.of("modelName", "DCS-7130"), reply);
    }

    @Test
    void normalizing_twice_gives_same_result() {
        Object once = normalizer.normalize(Map.of("modelName", Map.of("innerKey", List.of(Map.of("deepKey", 1)))));
        assertEquals(once, normalizer.normalize(once));
    }

    @Test
    void colliding_keys_fail_with_path() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("modelName", "a");
        inner.put("model_name", "b");
        Object reply = Map.of("a", List.of(inner));

        KeyCollisionException e = assertThrows(KeyCollisionException.class, () -> normalizer.normalize(reply));

        assertEquals("$.a[0]", e.getPath());
        assertEquals("modelName", e.getFirstKey());
        assertEquals("model_name", e.getSecondKey());
        assertEquals("model_name", e.getNormalizedKey());
    }

    @Test
    void null_from_transform_is_config_error() {
        KeyNormalizer broken = new KeyNormalizer(key -> null);
        assertThrows(TranslatorConfigException.class, () -> broken.normalize(Map.of("a", 1)));
    }
}
