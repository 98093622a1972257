package io.github.hongjungwan.evidence.api.domain;

import lombok.Builder;
import lombok.Getter;

/**
 * 원격 브라우저 스크린샷 요청 옵션.
 */
@Getter
@Builder(toBuilder = true)
public class ScreenshotOptions {

    @Builder.Default
    private final ImageFormat format = ImageFormat.PNG;

    /** JPEG 품질 1-100 (JPEG일 때만 전달) */
    private final Integer quality;

    /** 스크롤 영역 전체 캡처 여부 */
    @Builder.Default
    private final boolean fullPage = false;

    /** 캡처 채널 응답 대기 시간 (ms) */
    @Builder.Default
    private final long timeoutMs = 15_000;
}
