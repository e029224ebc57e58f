package com.nori.tc.netdut.capability;

import com.nori.tc.netdut.dialect.Dialect;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 테스트 실행 여부 판단에 쓰는 장비 정보.
 *
 * @param sku     장비 SKU (예: DCS-7130-48L-R)
 * @param dialect 장비 dialect
 */
public record DeviceIdentity(String sku, Dialect dialect) {

    private static final Pattern SKU_IN_TEXT = Pattern.compile("(DCS-7.*)");

    public DeviceIdentity {
        Objects.requireNonNull(sku, "sku must not be null");
        Objects.requireNonNull(dialect, "dialect must not be null");
    }

    /**
     * "show version" 텍스트 출력에서 SKU를 뽑는다. (첫 "DCS-7"부터 줄 끝까지)
     *
     * @throws IllegalStateException SKU가 없는 경우
     */
    public static String skuFromText(String showVersionText) {
        Objects.requireNonNull(showVersionText, "showVersionText must not be null");
        Matcher m = SKU_IN_TEXT.matcher(showVersionText);
        if (!m.find()) {
            throw new IllegalStateException("no SKU found in show version output");
        }
        return m.group(1).strip();
    }

    /**
     * "show version" 구조화 응답에서 SKU를 뽑는다. (model_name 또는 modelName)
     *
     * @throws IllegalStateException 모델명이 없는 경우
     */
    public static String skuFromReply(Map<?, ?> showVersionReply) {
        Objects.requireNonNull(showVersionReply, "showVersionReply must not be null");
        Object model = showVersionReply.get("model_name");
        if (model == null) {
            model = showVersionReply.get("modelName");
        }
        if (model == null) {
            throw new IllegalStateException("no model name in show version reply: " + showVersionReply.keySet());
        }
        return String.valueOf(model);
    }
}
