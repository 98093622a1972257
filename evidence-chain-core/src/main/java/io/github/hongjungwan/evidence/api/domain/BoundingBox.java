package io.github.hongjungwan.evidence.api.domain;

/**
 * 캡처 시점 뷰포트 좌표 기준 요소 영역.
 */
public record BoundingBox(
        double x,
        double y,
        double width,
        double height
) {
}
