package io.github.hongjungwan.evidence.core.internal;

import io.github.hongjungwan.evidence.api.config.EvidenceConfig;
import io.github.hongjungwan.evidence.api.domain.ImageFormat;
import io.github.hongjungwan.evidence.api.domain.ScreenshotMeta;
import io.github.hongjungwan.evidence.api.domain.ScreenshotOptions;
import io.github.hongjungwan.evidence.spi.CaptureChannel;
import io.github.hongjungwan.evidence.spi.EvidenceStorage;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.UUID;

/**
 * 스크린샷 무결성 처리. 원본 바이트 해시, 헤더 치수 추출, 체인별 네임스페이스에 저장.
 *
 * <p>치수 파싱 실패는 (0, 0)으로 계속 진행, 저장 실패는 그대로 전파.
 */
@Slf4j
public class ScreenshotCapturer {

    private static final String FILE_PREFIX = "screenshot-";

    private final EvidenceConfig config;
    private final EvidenceStorage storage;
    private final CaptureChannel channel;
    private final Clock clock;

    public ScreenshotCapturer(EvidenceConfig config, EvidenceStorage storage, CaptureChannel channel) {
        this(config, storage, channel, Clock.systemUTC());
    }

    public ScreenshotCapturer(EvidenceConfig config, EvidenceStorage storage, CaptureChannel channel, Clock clock) {
        this.config = config;
        this.storage = storage;
        this.channel = channel;
        this.clock = clock;
    }

    /** 캡처 채널로 스크린샷을 받아 저장 */
    public ScreenshotMeta capture(String chainId, ScreenshotOptions options) {
        ChainIds.requireValid(chainId);
        if (channel == null) {
            throw new IllegalStateException("No capture channel configured");
        }

        ScreenshotOptions effective = options.getFormat() == ImageFormat.JPEG
                ? options
                : options.toBuilder().quality(null).build();

        log.info("Capturing screenshot via {}: chainId={}, format={}",
                channel.getName(), chainId, effective.getFormat().getValue());

        String imageData = channel.captureScreenshot(effective);
        if (imageData == null || imageData.isEmpty()) {
            throw new CaptureChannel.CaptureException("Capture channel returned no image data");
        }

        byte[] raw;
        try {
            raw = Base64.getMimeDecoder().decode(imageData);
        } catch (IllegalArgumentException e) {
            throw new CaptureChannel.CaptureException("Capture channel returned malformed base64 image data", e);
        }

        return finalizeCapture(chainId, raw, effective.getFormat());
    }

    /** 캡처 옵션 기본값 (설정의 타임아웃 반영) */
    public ScreenshotOptions defaultOptions(ImageFormat format) {
        return ScreenshotOptions.builder()
                .format(format)
                .timeoutMs(config.getCaptureTimeoutMs())
                .build();
    }

    /**
     * 원본 이미지 바이트로 메타데이터 생성 후 저장.
     *
     * @throws EvidenceStorage.StorageException 저장 실패
     */
    public ScreenshotMeta finalizeCapture(String chainId, byte[] raw, ImageFormat format) {
        ChainIds.requireValid(chainId);
        if (raw == null) {
            throw new IllegalArgumentException("Screenshot bytes must not be null");
        }
        if (format == null) {
            throw new IllegalArgumentException("Image format must not be null");
        }

        String hash = RecordHasher.sha256Hex(raw);
        ImageDimensions.Dimensions dimensions = ImageDimensions.parse(raw, format);
        if (dimensions.equals(ImageDimensions.UNKNOWN)) {
            log.warn("Could not read {} dimensions for screenshot of chain {}", format.getValue(), chainId);
        }

        Instant capturedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        String key = config.getScreenshotsNamespace() + "/" + chainId + "/" + FILE_PREFIX
                + TimestampNames.of(capturedAt) + "-" + shortSuffix() + "." + format.getExtension();

        storage.write(key, raw);

        log.info("Screenshot stored: chainId={}, hash={}, size={}, {}x{}",
                chainId, hash.substring(0, 16), raw.length, dimensions.width(), dimensions.height());

        return ScreenshotMeta.builder()
                .hash(hash)
                .path(key)
                .width(dimensions.width())
                .height(dimensions.height())
                .capturedAt(capturedAt)
                .format(format)
                .build();
    }

    private static String shortSuffix() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
