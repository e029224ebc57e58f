package com.nori.tc.netdut.translate;

import com.nori.tc.netdut.dialect.Dialect;

/**
 * 번역기에 규칙 테이블이 등록되지 않은 dialect를 요청한 경우.
 *
 * 번역되지 않은 canonical 명령을 호환되지 않는 장비에 그대로 보내는 것을 막기 위해
 * pass-through 대신 실패시킨다.
 */
public class UnknownDialectException extends TranslatorConfigException {

    private final Dialect dialect;

    public UnknownDialectException(Dialect dialect) {
        super("no translation rules registered for dialect: " + dialect);
        this.dialect = dialect;
    }

    public Dialect getDialect() {
        return dialect;
    }
}
