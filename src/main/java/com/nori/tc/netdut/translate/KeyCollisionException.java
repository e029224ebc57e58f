package com.nori.tc.netdut.translate;

/**
 * 하나의 mapping 안에서 서로 다른 두 원본 키가 같은 키로 변환된 경우.
 */
public class KeyCollisionException extends TranslationException {

    private final String path;
    private final String firstKey;
    private final String secondKey;
    private final String normalizedKey;

    public KeyCollisionException(String path, String firstKey, String secondKey, String normalizedKey) {
        super("keys '" + firstKey + "' and '" + secondKey + "' both normalize to '"
                + normalizedKey + "' at " + path);
        this.path = path;
        this.firstKey = firstKey;
        this.secondKey = secondKey;
        this.normalizedKey = normalizedKey;
    }

    public String getPath() {
        return path;
    }

    public String getFirstKey() {
        return firstKey;
    }

    public String getSecondKey() {
        return secondKey;
    }

    public String getNormalizedKey() {
        return normalizedKey;
    }
}
