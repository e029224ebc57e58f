package com.nori.tc.netdut.translate;

/**
 * 번역기 구성 오류.
 *
 * - 잘못된 정규식, 잘못된 치환 템플릿, 등록되지 않은 dialect 등
 * - 번역기/규칙 테이블을 만드는 시점에 즉시 발생시킨다. (번역 시점으로 미루지 않음)
 */
public class TranslatorConfigException extends IllegalStateException {

    public TranslatorConfigException(String message) {
        super(message);
    }

    public TranslatorConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
