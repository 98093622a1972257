package io.github.hongjungwan.evidence.api.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Getter;

/**
 * 추출 요소 재탐색용 3계층 앵커. CSS 셀렉터가 깨져도 XPath, 텍스트로 다시 찾을 수 있음.
 *
 * <p>primaryTier는 AnchorBuilder가 계산한 값. 저장된 값은 해시 대상이므로 로드 시 재계산하지 않음.
 */
@Getter
@Builder
@JsonDeserialize(builder = DomAnchor.DomAnchorBuilder.class)
public class DomAnchor {

    /** CSS 셀렉터 경로 (빈 문자열 가능) */
    private final String cssSelector;

    /** XPath 표현식 (빈 문자열 가능) */
    private final String xpath;

    /** 요소 텍스트 (최대 500자) */
    private final String textContent;

    /** 우선 계층 */
    private final AnchorTier primaryTier;

    /** 캡처 시점 요소 영역 (선택) */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final BoundingBox boundingBox;

    @JsonPOJOBuilder(withPrefix = "")
    public static class DomAnchorBuilder {
    }
}
