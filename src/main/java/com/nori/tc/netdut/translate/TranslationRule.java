package com.nori.tc.netdut.translate;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * (pattern, replacement) 번역 규칙 1개.
 *
 * 매칭 규칙:
 * - 패턴은 명령 줄의 "시작"에 고정된다. (Matcher.lookingAt)
 * - 줄 끝까지 매칭할 필요는 없다. 매칭되지 않은 꼬리는 결과에 포함되지 않는다.
 *   줄 전체를 보려면 패턴 끝에 ".*" 또는 "$"를 둔다.
 * - 대소문자를 구분한다. 필요하면 패턴에 (?i)를 쓴다.
 *
 * 정규식/템플릿 오류는 생성 시점에 TranslatorConfigException으로 실패한다.
 */
public final class TranslationRule {

    private final Pattern pattern;

    /** null이면 "번역 불가" 규칙 */
    private final ReplacementTemplate replacement;

    private TranslationRule(Pattern pattern, ReplacementTemplate replacement) {
        this.pattern = pattern;
        this.replacement = replacement;
    }

    public static TranslationRule of(String regex, String replacement) {
        Pattern p = compile(regex);
        return new TranslationRule(p, ReplacementTemplate.parse(replacement, p));
    }

    /**
     * 매칭되는 줄을 대상 dialect로 옮길 수 없음을 선언하는 규칙.
     * 매칭 시 UntranslatableCommandException.
     */
    public static TranslationRule untranslatable(String regex) {
        return new TranslationRule(compile(regex), null);
    }

    public String pattern() {
        return pattern.pattern();
    }

    /**
     * @return 치환 템플릿 원문. 번역 불가 규칙이면 null
     */
    public String replacement() {
        return replacement != null ? replacement.source() : null;
    }

    public boolean isUntranslatable() {
        return replacement == null;
    }

    /**
     * @param line 명령 줄
     * @return 치환 결과. 매칭되지 않으면 null
     * @throws UntranslatableCommandException 번역 불가 규칙에 매칭된 경우
     */
    String rewrite(String line) {
        Matcher m = pattern.matcher(line);
        if (!m.lookingAt()) {
            return null;
        }
        if (replacement == null) {
            throw new UntranslatableCommandException(line, pattern.pattern(), null);
        }
        return replacement.expand(m);
    }

    private static Pattern compile(String regex) {
        Objects.requireNonNull(regex, "regex must not be null");
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new TranslatorConfigException("invalid rule pattern: " + regex, e);
        }
    }

    @Override
    public String toString() {
        return pattern.pattern() + " -> " + (replacement != null ? replacement.source() : "<untranslatable>");
    }
}
