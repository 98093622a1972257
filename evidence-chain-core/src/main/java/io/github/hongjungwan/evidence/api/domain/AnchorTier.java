package io.github.hongjungwan.evidence.api.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * DOM 앵커 계층. 페이지 구조 변경에 대한 안정성 순서 (CSS > XPath > 텍스트).
 */
public enum AnchorTier {

    /** CSS 셀렉터 */
    CSS("css"),

    /** XPath 표현식 */
    XPATH("xpath"),

    /** 요소 텍스트 (최후 수단) */
    TEXT_CONTENT("text-content");

    private final String value;

    AnchorTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AnchorTier fromValue(String value) {
        for (AnchorTier tier : values()) {
            if (tier.value.equals(value)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown anchor tier: " + value);
    }
}
