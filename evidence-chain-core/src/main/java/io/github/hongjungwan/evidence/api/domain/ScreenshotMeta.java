package io.github.hongjungwan.evidence.api.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * 스크린샷 무결성 메타데이터.
 */
@Getter
@Builder
@JsonDeserialize(builder = ScreenshotMeta.ScreenshotMetaBuilder.class)
public class ScreenshotMeta {

    /** 원본 이미지 바이트의 SHA-256 (hex) */
    private final String hash;

    /** 증거 루트 기준 상대 경로 */
    private final String path;

    /** 헤더에서 읽은 너비 (실패 시 0) */
    private final int width;

    /** 헤더에서 읽은 높이 (실패 시 0) */
    private final int height;

    private final Instant capturedAt;

    private final ImageFormat format;

    @JsonPOJOBuilder(withPrefix = "")
    public static class ScreenshotMetaBuilder {
    }
}
