package io.github.hongjungwan.evidence.core.internal;

import io.github.hongjungwan.evidence.api.domain.ImageFormat;
import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;

/**
 * 이미지 헤더에서 너비/높이 추출. 디코딩 라이브러리 없이 바이트 레이아웃만 읽음.
 *
 * <p>파싱 실패는 오류가 아님. 어떤 입력이든 예외 없이 (0, 0)으로 대체.
 */
@Slf4j
public final class ImageDimensions {

    public static final Dimensions UNKNOWN = new Dimensions(0, 0);

    /** IHDR 고정 레이아웃: 시그니처(8) + 길이(4) + 타입(4) + 너비(4) + 높이(4) */
    private static final int PNG_MIN_LENGTH = 24;
    private static final int PNG_WIDTH_OFFSET = 16;
    private static final int PNG_HEIGHT_OFFSET = 20;

    private static final int JPEG_MARKER_PREFIX = 0xFF;
    private static final int JPEG_FIRST_MARKER_OFFSET = 2;

    private ImageDimensions() {}

    public static Dimensions parse(byte[] data, ImageFormat format) {
        if (data == null || format == null) {
            return UNKNOWN;
        }
        try {
            return switch (format) {
                case PNG -> parsePng(ByteBuffer.wrap(data));
                case JPEG -> parseJpeg(ByteBuffer.wrap(data));
            };
        } catch (RuntimeException e) {
            log.debug("Failed to parse {} dimensions: {}", format, e.getMessage());
            return UNKNOWN;
        }
    }

    static Dimensions parsePng(ByteBuffer buffer) {
        if (buffer.limit() < PNG_MIN_LENGTH) {
            return UNKNOWN;
        }
        long width = Integer.toUnsignedLong(buffer.getInt(PNG_WIDTH_OFFSET));
        long height = Integer.toUnsignedLong(buffer.getInt(PNG_HEIGHT_OFFSET));
        if (width > Integer.MAX_VALUE || height > Integer.MAX_VALUE) {
            return UNKNOWN;
        }
        return new Dimensions((int) width, (int) height);
    }

    /** SOF 마커(0xC0-0xCF, 0xC4/0xC8 제외)까지 세그먼트 길이만큼 건너뜀 */
    static Dimensions parseJpeg(ByteBuffer buffer) {
        int offset = JPEG_FIRST_MARKER_OFFSET;
        int length = buffer.limit();

        while (offset < length - 8) {
            if (Byte.toUnsignedInt(buffer.get(offset)) != JPEG_MARKER_PREFIX) {
                break;
            }
            int marker = Byte.toUnsignedInt(buffer.get(offset + 1));
            if (isStartOfFrame(marker)) {
                int height = Short.toUnsignedInt(buffer.getShort(offset + 5));
                int width = Short.toUnsignedInt(buffer.getShort(offset + 7));
                return new Dimensions(width, height);
            }
            int segmentLength = Short.toUnsignedInt(buffer.getShort(offset + 2));
            offset += 2 + segmentLength;
        }
        return UNKNOWN;
    }

    private static boolean isStartOfFrame(int marker) {
        return marker >= 0xC0 && marker <= 0xCF && marker != 0xC4 && marker != 0xC8;
    }

    public record Dimensions(int width, int height) {
    }
}
