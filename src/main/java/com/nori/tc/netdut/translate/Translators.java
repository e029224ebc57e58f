package com.nori.tc.netdut.translate;

import com.nori.tc.netdut.dialect.Dialect;

/**
 * 기본 번역기 구성.
 */
public final class Translators {

    private static final RuleTable MOS_RULES = RuleTable.builder()
            .rule("interface ap1/(.*)", "interface ap\\1")
            .rule("l1 source interface ap1/(.*)", "source ap\\1")
            .untranslatable("l1 source interface ap(.*)")
            .rule("l1 source interface (.*)", "source \\1")
            .rule("l1 source mac", "source mac")
            .rule("no l1 source", "no source")
            .untranslatable("bash sudo cortina")
            .rule("traffic-loopback source network device phy", "loopback internal")
            .rule("traffic-loopback source system device phy", "loopback")
            .rule("no traffic-loopback", "no loopback")
            .build();

    private static final Translator STANDARD = Translator.builder()
            .rules(Dialect.MOS, MOS_RULES)
            .keyTransform(KeyTransforms.camelToSnake())
            .build();

    private Translators() {
        // utility class
    }

    /**
     * EOS 명령 -> MOS 명령 규칙. 순서가 의미를 가진다. (ap1/ 규칙이 일반 규칙보다 먼저)
     */
    public static RuleTable mosRules() {
        return MOS_RULES;
    }

    /**
     * EOS canonical + MOS 규칙 + camelCase -> snake_case 키 변환
     */
    public static Translator standard() {
        return STANDARD;
    }

    /**
     * canonical dialect만 지원하는 번역기 (모든 호출이 identity)
     */
    public static Translator canonicalOnly() {
        return Translator.builder().build();
    }
}
