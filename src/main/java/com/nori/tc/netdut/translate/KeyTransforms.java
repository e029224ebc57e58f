package com.nori.tc.netdut.translate;

/**
 * 기본 제공 KeyTransform 모음.
 */
public final class KeyTransforms {

    private static final KeyTransform CAMEL_TO_SNAKE = KeyTransforms::camelToSnake;

    private KeyTransforms() {
        // utility class
    }

    /**
     * camelCase -> snake_case.
     *
     * - '/'로 나뉜 각 구간을 따로 변환한다. (예: "ap1/linkStatus" -> "ap1/link_status")
     * - 구간의 첫 글자가 아닌 대문자 앞에 '_'를 넣고 전체를 소문자로 바꾼다.
     * - 결과에는 대문자가 없으므로 다시 적용해도 그대로다.
     */
    public static KeyTransform camelToSnake() {
        return CAMEL_TO_SNAKE;
    }

    public static KeyTransform identity() {
        return KeyTransform.identity();
    }

    static String camelToSnake(String key) {
        StringBuilder out = new StringBuilder(key.length() + 8);
        int segmentStart = 0;
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c == '/') {
                out.append(c);
                segmentStart = i + 1;
                continue;
            }
            if (Character.isUpperCase(c)) {
                if (i > segmentStart) {
                    out.append('_');
                }
                out.append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
