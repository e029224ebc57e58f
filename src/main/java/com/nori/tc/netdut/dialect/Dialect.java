package com.nori.tc.netdut.dialect;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 장비의 명령/응답 규약(dialect) 식별자.
 *
 * - 식별자는 소문자로 normalize 한다. ("MOS" == "mos")
 * - EOS가 테스트 작성자가 쓰는 canonical 형태이다.
 * - 세션당 정확히 하나의 dialect가 활성화된다.
 */
public final class Dialect {

    public static final Dialect EOS = new Dialect("eos");
    public static final Dialect MOS = new Dialect("mos");

    private static final Pattern ID_PATTERN = Pattern.compile("[a-z0-9][a-z0-9_-]*");

    private final String id;

    private Dialect(String id) {
        this.id = id;
    }

    /**
     * @param id dialect 식별자 (대소문자 무시, 앞뒤 공백 제거)
     * @throws IllegalArgumentException 비어 있거나 허용되지 않는 문자가 있을 때
     */
    public static Dialect of(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("dialect id is blank");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        if (!ID_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("invalid dialect id: " + id);
        }
        if (EOS.id.equals(normalized)) {
            return EOS;
        }
        if (MOS.id.equals(normalized)) {
            return MOS;
        }
        return new Dialect(normalized);
    }

    public String id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dialect other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
