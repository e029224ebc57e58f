package com.nori.tc.netdut.translate;

import com.nori.tc.netdut.dialect.Dialect;

/**
 * 대상 dialect로 옮길 수 없다고 선언된 규칙에 명령 줄이 걸린 경우.
 *
 * - dialect는 규칙 테이블 단독 사용 시 null일 수 있다.
 */
public class UntranslatableCommandException extends TranslationException {

    private final String commandLine;
    private final String rulePattern;
    private final Dialect dialect;

    public UntranslatableCommandException(String commandLine, String rulePattern, Dialect dialect) {
        super("command cannot be translated"
                + (dialect != null ? " for dialect " + dialect : "")
                + ": '" + commandLine + "' (rule: " + rulePattern + ")");
        this.commandLine = commandLine;
        this.rulePattern = rulePattern;
        this.dialect = dialect;
    }

    UntranslatableCommandException forDialect(Dialect target) {
        return new UntranslatableCommandException(commandLine, rulePattern, target);
    }

    public String getCommandLine() {
        return commandLine;
    }

    public String getRulePattern() {
        return rulePattern;
    }

    public Dialect getDialect() {
        return dialect;
    }
}
