package com.nori.tc.netdut.translate;

/**
 * 응답 mapping 키 하나를 canonical 표기로 바꾸는 함수.
 *
 * 구현은 반드시 멱등이어야 한다: apply(apply(k)) == apply(k).
 * 일부 장비는 이미 canonical 표기인 필드를 섞어서 돌려주기 때문이다.
 */
@FunctionalInterface
public interface KeyTransform {

    /**
     * @param key 원본 키 (null 아님)
     * @return 변환된 키 (null 아님)
     */
    String apply(String key);

    /**
     * 키를 바꾸지 않는 변환.
     */
    static KeyTransform identity() {
        return key -> key;
    }
}
