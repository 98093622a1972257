package io.github.hongjungwan.evidence.api.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 스크린샷 이미지 포맷.
 */
public enum ImageFormat {

    PNG("png", "png"),
    JPEG("jpeg", "jpg");

    private final String value;
    private final String extension;

    ImageFormat(String value, String extension) {
        this.value = value;
        this.extension = extension;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** 저장 파일 확장자 */
    public String getExtension() {
        return extension;
    }

    @JsonCreator
    public static ImageFormat fromValue(String value) {
        for (ImageFormat format : values()) {
            if (format.value.equalsIgnoreCase(value)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported image format: " + value);
    }
}
