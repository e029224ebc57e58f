package com.nori.tc.netdut.translate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * KeyNormalizer
 *
 * 중첩 응답(Map / List / scalar)의 모든 mapping 키를 KeyTransform으로 바꾼다.
 *
 * 정책:
 * - Map: 키를 변환하고 값으로 재귀한다. 키 순서는 원본 순서를 유지한다.
 * - List: 원소 순서/개수를 그대로 두고 각 원소로 재귀한다. (원소 자체는 키가 아님)
 * - scalar: 그대로 반환한다.
 * - 같은 mapping 안에서 두 키가 같은 키로 변환되면 KeyCollisionException.
 * - 원본은 수정하지 않고 새 Map/List를 만든다.
 */
public final class KeyNormalizer {

    private final KeyTransform transform;

    public KeyNormalizer(KeyTransform transform) {
        this.transform = Objects.requireNonNull(transform, "transform must not be null");
    }

    public Object normalize(Object response) {
        return normalizeValue(response, "$");
    }

    private Object normalizeValue(Object value, String path) {
        if (value instanceof Map<?, ?> map) {
            return normalizeMap(map, path);
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                out.add(normalizeValue(list.get(i), path + "[" + i + "]"));
            }
            return out;
        }
        return value;
    }

    private Map<String, Object> normalizeMap(Map<?, ?> map, String path) {
        Map<String, Object> out = new LinkedHashMap<>();
        Map<String, String> originalByNormalized = new HashMap<>();

        for (Map.Entry<?, ?> e : map.entrySet()) {
            String key = String.valueOf(e.getKey());
            String normalized = transform.apply(key);
            if (normalized == null) {
                throw new TranslatorConfigException("key transform returned null for key '" + key + "' at " + path);
            }

            String previous = originalByNormalized.putIfAbsent(normalized, key);
            if (previous != null) {
                throw new KeyCollisionException(path, previous, key, normalized);
            }

            out.put(normalized, normalizeValue(e.getValue(), path + "." + normalized));
        }
        return out;
    }
}
