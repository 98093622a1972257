package io.github.hongjungwan.evidence.spi;

import io.github.hongjungwan.evidence.api.domain.BoundingBox;

/**
 * 원격 문서 검사 스크립트 결과.
 */
public record ElementInspection(
        String cssSelector,
        String xpath,
        String textContent,
        BoundingBox boundingBox
) {
}
