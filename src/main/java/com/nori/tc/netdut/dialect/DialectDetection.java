package com.nori.tc.netdut.dialect;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 콘솔 출력으로 장비 dialect를 추정한다.
 *
 * - 로그인 배너: "Metamako MOS ... ttyS0" 배너 뒤 login 프롬프트면 MOS, 그 외 "host login:"이면 EOS
 * - show version: "Hardware version:" 항목이 있으면 EOS, 없으면 MOS
 *
 * show version 판정이 배너 판정보다 우선한다. (배너는 콘솔 서버 설정에 따라 빠질 수 있다)
 * 줄바꿈은 "\n"으로 정규화된 출력을 전제로 한다.
 */
public final class DialectDetection {

    private static final Pattern MOS_LOGIN_BANNER =
            Pattern.compile("Metamako MOS \\S+ \\S+ (?:/dev/)?ttyS0\\n\\s*\\n.*login: ?\\z");

    private static final Pattern LOGIN_PROMPT = Pattern.compile("\\S+ login: ?\\z");

    private static final Pattern EOS_VERSION_FIELD = Pattern.compile("(?m)^Hardware version:");

    private DialectDetection() {
        // utility class
    }

    /**
     * @param banner login 프롬프트까지 포함한 콘솔 출력
     * @return login 프롬프트가 없으면 empty
     */
    public static Optional<Dialect> fromLoginBanner(String banner) {
        Objects.requireNonNull(banner, "banner must not be null");
        if (MOS_LOGIN_BANNER.matcher(banner).find()) {
            return Optional.of(Dialect.MOS);
        }
        if (LOGIN_PROMPT.matcher(banner).find()) {
            return Optional.of(Dialect.EOS);
        }
        return Optional.empty();
    }

    public static Dialect fromShowVersion(String showVersion) {
        Objects.requireNonNull(showVersion, "showVersion must not be null");
        return EOS_VERSION_FIELD.matcher(showVersion).find() ? Dialect.EOS : Dialect.MOS;
    }
}
