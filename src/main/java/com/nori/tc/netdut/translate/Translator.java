package com.nori.tc.netdut.translate;

import com.nori.tc.netdut.dialect.Dialect;
import com.nori.tc.netdut.logging.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Translator
 *
 * 역할:
 * - canonical(EOS) 명령 목록 -> 장비 dialect 명령 목록 (줄 단위, 순서 유지)
 * - 장비 dialect 응답 -> canonical 키 표기 응답 (KeyNormalizer)
 *
 * 규칙:
 * - canonical dialect 요청은 명령/응답 모두 그대로 돌려준다.
 * - 규칙 테이블이 없는 dialect 요청은 UnknownDialectException.
 * - 생성 후 불변이다. 여러 세션/스레드가 한 인스턴스를 공유해도 된다.
 * - 다른 규칙이 필요하면 toBuilder()로 새 인스턴스를 만든다.
 */
public final class Translator {

    private static final Logger log = LoggerFactory.getLogger(Translator.class);

    private final Dialect canonical;
    private final Map<Dialect, RuleTable> rulesByDialect;
    private final KeyTransform keyTransform;
    private final KeyNormalizer normalizer;

    private Translator(Builder b) {
        this.canonical = b.canonical;
        this.rulesByDialect = Collections.unmodifiableMap(new LinkedHashMap<>(b.rules));
        this.keyTransform = b.keyTransform;
        this.normalizer = new KeyNormalizer(b.keyTransform);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder().canonical(canonical).keyTransform(keyTransform);
        rulesByDialect.forEach(b::rules);
        return b;
    }

    public Dialect canonical() {
        return canonical;
    }

    /**
     * canonical dialect + 규칙 테이블이 등록된 dialect 목록
     */
    public Set<Dialect> dialects() {
        Set<Dialect> out = new LinkedHashSet<>();
        out.add(canonical);
        out.addAll(rulesByDialect.keySet());
        return Collections.unmodifiableSet(out);
    }

    public boolean supports(Dialect dialect) {
        return canonical.equals(dialect) || rulesByDialect.containsKey(dialect);
    }

    /**
     * @throws UnknownDialectException 지원하지 않는 dialect
     */
    public void requireSupported(Dialect dialect) {
        Objects.requireNonNull(dialect, "dialect must not be null");
        if (!supports(dialect)) {
            throw new UnknownDialectException(dialect);
        }
    }

    public RuleTable rules(Dialect dialect) {
        requireSupported(dialect);
        return canonical.equals(dialect) ? RuleTable.empty() : rulesByDialect.get(dialect);
    }

    /**
     * @param dialect  장비 dialect
     * @param commands canonical 명령 줄 목록
     * @return 장비 dialect 명령 줄 목록 (입력과 같은 길이)
     */
    public List<String> translateCommands(Dialect dialect, List<String> commands) {
        Objects.requireNonNull(commands, "commands must not be null");
        requireSupported(dialect);

        if (canonical.equals(dialect)) {
            return List.copyOf(commands);
        }

        RuleTable table = rulesByDialect.get(dialect);
        List<String> out = new ArrayList<>(commands.size());
        for (String line : commands) {
            try {
                out.add(table.rewrite(line));
            } catch (UntranslatableCommandException e) {
                throw e.forDialect(dialect);
            }
        }

        if (!out.equals(commands)) {
            log.debug(StructuredLog.event("commands_translated",
                    "dialect", dialect,
                    "before", commands,
                    "after", out));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * 여러 줄 문자열 버전. CommandLines.split 규칙으로 나눈 뒤 번역한다.
     */
    public List<String> translateCommands(Dialect dialect, String block) {
        return translateCommands(dialect, CommandLines.split(block));
    }

    /**
     * @param dialect  응답을 보낸 장비의 dialect
     * @param response Map / List / scalar 로 이뤄진 응답
     * @return 키가 canonical 표기로 바뀐 응답 (구조/값/순서는 동일)
     */
    public Object translateResponse(Dialect dialect, Object response) {
        requireSupported(dialect);
        if (canonical.equals(dialect)) {
            return response;
        }
        return normalizer.normalize(response);
    }

    @Override
    public String toString() {
        return "Translator{canonical=" + canonical + ", dialects=" + rulesByDialect.keySet() + "}";
    }

    public static final class Builder {

        private Dialect canonical = Dialect.EOS;
        private final Map<Dialect, RuleTable> rules = new LinkedHashMap<>();
        private KeyTransform keyTransform = KeyTransforms.camelToSnake();

        private Builder() {
        }

        public Builder canonical(Dialect canonical) {
            this.canonical = Objects.requireNonNull(canonical, "canonical must not be null");
            return this;
        }

        /**
         * dialect의 규칙 테이블을 통째로 지정(교체)한다.
         */
        public Builder rules(Dialect dialect, RuleTable table) {
            Objects.requireNonNull(dialect, "dialect must not be null");
            Objects.requireNonNull(table, "table must not be null");
            rules.put(dialect, table);
            return this;
        }

        /**
         * 기존 테이블 "앞"에 규칙을 덧붙인다. (기존 규칙보다 먼저 시도)
         */
        public Builder rulesBefore(Dialect dialect, RuleTable table) {
            RuleTable existing = rules.getOrDefault(dialect, RuleTable.empty());
            return rules(dialect, existing.prepend(table));
        }

        /**
         * 기존 테이블 "뒤"에 규칙을 덧붙인다.
         */
        public Builder rulesAfter(Dialect dialect, RuleTable table) {
            RuleTable existing = rules.getOrDefault(dialect, RuleTable.empty());
            return rules(dialect, existing.append(table));
        }

        public Builder keyTransform(KeyTransform keyTransform) {
            this.keyTransform = Objects.requireNonNull(keyTransform, "keyTransform must not be null");
            return this;
        }

        /**
         * @throws TranslatorConfigException canonical dialect에 규칙 테이블을 등록한 경우
         */
        public Translator build() {
            if (rules.containsKey(canonical)) {
                throw new TranslatorConfigException("canonical dialect must not have a rule table: " + canonical);
            }
            return new Translator(this);
        }
    }
}
