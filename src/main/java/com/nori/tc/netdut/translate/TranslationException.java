package com.nori.tc.netdut.translate;

/**
 * 입력 데이터 때문에 번역이 불가능한 경우의 기본 예외.
 * 메시지에는 문제가 된 명령 줄 또는 키를 반드시 포함한다.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) {
        super(message);
    }
}
