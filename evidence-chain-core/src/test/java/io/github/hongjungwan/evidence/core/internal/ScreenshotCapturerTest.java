package io.github.hongjungwan.evidence.core.internal;

import io.github.hongjungwan.evidence.api.config.EvidenceConfig;
import io.github.hongjungwan.evidence.api.domain.ImageFormat;
import io.github.hongjungwan.evidence.api.domain.ScreenshotMeta;
import io.github.hongjungwan.evidence.api.domain.ScreenshotOptions;
import io.github.hongjungwan.evidence.spi.CaptureChannel;
import io.github.hongjungwan.evidence.spi.EvidenceStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ScreenshotCapturer 테스트")
@ExtendWith(MockitoExtension.class)
class ScreenshotCapturerTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-03-01T09:15:30.250Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Mock
    private CaptureChannel channel;

    private EvidenceConfig config;
    private FileEvidenceStorage storage;
    private ScreenshotCapturer capturer;

    @BeforeEach
    void setUp() {
        config = EvidenceConfig.builder().evidenceDirectory(tempDir.toString()).build();
        storage = new FileEvidenceStorage(tempDir);
        capturer = new ScreenshotCapturer(config, storage, channel, FIXED_CLOCK);
    }

    @Nested
    @DisplayName("원본 바이트 처리")
    class FinalizeTests {

        @Test
        @DisplayName("PNG 800x600의 해시, 치수, 경로를 기록해야 한다")
        void shouldRecordPngMetadata() throws IOException {
            // given
            byte[] raw = ImageDimensionsTest.png(800, 600);

            // when
            ScreenshotMeta meta = capturer.finalizeCapture("c1", raw, ImageFormat.PNG);

            // then
            assertThat(meta.getWidth()).isEqualTo(800);
            assertThat(meta.getHeight()).isEqualTo(600);
            assertThat(meta.getFormat()).isEqualTo(ImageFormat.PNG);
            assertThat(meta.getHash()).isEqualTo(RecordHasher.sha256Hex(raw));
            assertThat(meta.getCapturedAt()).isEqualTo(Instant.parse("2026-03-01T09:15:30.250Z"));
            assertThat(meta.getPath())
                    .startsWith("screenshots/c1/screenshot-2026-03-01T09-15-30-250Z-")
                    .endsWith(".png");
            assertThat(Files.readAllBytes(tempDir.resolve(meta.getPath()))).isEqualTo(raw);
        }

        @Test
        @DisplayName("JPEG는 jpg 확장자와 SOF 치수를 사용해야 한다")
        void shouldRecordJpegMetadata() {
            // when
            ScreenshotMeta meta = capturer.finalizeCapture("c1", ImageDimensionsTest.jpeg(1280, 720, 0xC0),
                    ImageFormat.JPEG);

            // then
            assertThat(meta.getWidth()).isEqualTo(1280);
            assertThat(meta.getHeight()).isEqualTo(720);
            assertThat(meta.getPath()).endsWith(".jpg");
        }

        @Test
        @DisplayName("치수를 읽을 수 없어도 (0, 0)으로 저장해야 한다")
        void shouldStoreUnparseableImage() {
            // given
            byte[] raw = {1, 2, 3};

            // when
            ScreenshotMeta meta = capturer.finalizeCapture("c1", raw, ImageFormat.PNG);

            // then
            assertThat(meta.getWidth()).isZero();
            assertThat(meta.getHeight()).isZero();
            assertThat(tempDir.resolve(meta.getPath())).exists();
        }

        @Test
        @DisplayName("같은 시각의 두 캡처는 서로 다른 경로를 가져야 한다")
        void shouldNotOverwriteWithinSameInstant() {
            // when
            ScreenshotMeta first = capturer.finalizeCapture("c1", ImageDimensionsTest.png(1, 1), ImageFormat.PNG);
            ScreenshotMeta second = capturer.finalizeCapture("c1", ImageDimensionsTest.png(2, 2), ImageFormat.PNG);

            // then
            assertThat(first.getPath()).isNotEqualTo(second.getPath());
        }

        @Test
        @DisplayName("저장 실패는 그대로 전파되어야 한다")
        void shouldPropagateStorageFailure(@Mock EvidenceStorage failingStorage) {
            // given
            doThrow(new EvidenceStorage.StorageException("disk full", null))
                    .when(failingStorage).write(anyString(), any());
            ScreenshotCapturer failing = new ScreenshotCapturer(config, failingStorage, channel, FIXED_CLOCK);

            // then
            assertThatThrownBy(() -> failing.finalizeCapture("c1", ImageDimensionsTest.png(8, 8), ImageFormat.PNG))
                    .isInstanceOf(EvidenceStorage.StorageException.class)
                    .hasMessageContaining("disk full");
        }

        @Test
        @DisplayName("잘못된 인자는 거부해야 한다")
        void shouldRejectInvalidArguments() {
            assertThatThrownBy(() -> capturer.finalizeCapture(" ", new byte[0], ImageFormat.PNG))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> capturer.finalizeCapture("c1", null, ImageFormat.PNG))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> capturer.finalizeCapture("c1", new byte[0], null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("경로 구분자가 든 체인 ID는 저장 전에 거부해야 한다")
        void shouldRejectChainIdWithPathSeparator() {
            assertThatThrownBy(() -> capturer.finalizeCapture("a/b", ImageDimensionsTest.png(8, 8), ImageFormat.PNG))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Invalid chain id: a/b");
            assertThatThrownBy(() -> capturer.finalizeCapture("..", ImageDimensionsTest.png(8, 8), ImageFormat.PNG))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(tempDir.resolve("screenshots")).doesNotExist();
        }
    }

    @Nested
    @DisplayName("채널 캡처")
    class CaptureTests {

        @Test
        @DisplayName("채널이 반환한 base64를 디코딩해 저장해야 한다")
        void shouldDecodeChannelOutput() throws IOException {
            // given
            byte[] raw = ImageDimensionsTest.png(320, 240);
            when(channel.getName()).thenReturn("mock");
            when(channel.captureScreenshot(any())).thenReturn(Base64.getEncoder().encodeToString(raw));

            // when
            ScreenshotMeta meta = capturer.capture("c1", capturer.defaultOptions(ImageFormat.PNG));

            // then
            assertThat(meta.getWidth()).isEqualTo(320);
            assertThat(meta.getHeight()).isEqualTo(240);
            assertThat(meta.getHash()).isEqualTo(RecordHasher.sha256Hex(raw));
            assertThat(Files.readAllBytes(tempDir.resolve(meta.getPath()))).isEqualTo(raw);
        }

        @Test
        @DisplayName("PNG 캡처에는 품질 옵션을 전달하지 않아야 한다")
        void shouldDropQualityForPng() {
            // given
            when(channel.getName()).thenReturn("mock");
            when(channel.captureScreenshot(any()))
                    .thenReturn(Base64.getEncoder().encodeToString(ImageDimensionsTest.png(1, 1)));
            ScreenshotOptions options = ScreenshotOptions.builder().format(ImageFormat.PNG).quality(80).build();

            // when
            capturer.capture("c1", options);

            // then
            ArgumentCaptor<ScreenshotOptions> sent = ArgumentCaptor.forClass(ScreenshotOptions.class);
            verify(channel).captureScreenshot(sent.capture());
            assertThat(sent.getValue().getQuality()).isNull();
        }

        @Test
        @DisplayName("JPEG 캡처에는 품질 옵션을 전달해야 한다")
        void shouldKeepQualityForJpeg() {
            // given
            when(channel.getName()).thenReturn("mock");
            when(channel.captureScreenshot(any()))
                    .thenReturn(Base64.getEncoder().encodeToString(ImageDimensionsTest.jpeg(2, 2, 0xC0)));
            ScreenshotOptions options = ScreenshotOptions.builder()
                    .format(ImageFormat.JPEG).quality(70).fullPage(true).build();

            // when
            ScreenshotMeta meta = capturer.capture("c1", options);

            // then
            ArgumentCaptor<ScreenshotOptions> sent = ArgumentCaptor.forClass(ScreenshotOptions.class);
            verify(channel).captureScreenshot(sent.capture());
            assertThat(sent.getValue().getQuality()).isEqualTo(70);
            assertThat(sent.getValue().isFullPage()).isTrue();
            assertThat(meta.getFormat()).isEqualTo(ImageFormat.JPEG);
        }

        @Test
        @DisplayName("잘못된 base64는 CaptureException이어야 한다")
        void shouldRejectMalformedBase64() {
            // given
            when(channel.getName()).thenReturn("mock");
            when(channel.captureScreenshot(any())).thenReturn("QUJDR");

            // then
            assertThatThrownBy(() -> capturer.capture("c1", capturer.defaultOptions(ImageFormat.PNG)))
                    .isInstanceOf(CaptureChannel.CaptureException.class);
        }

        @Test
        @DisplayName("빈 응답은 CaptureException이어야 한다")
        void shouldRejectEmptyResponse() {
            // given
            when(channel.getName()).thenReturn("mock");
            when(channel.captureScreenshot(any())).thenReturn("");

            // then
            assertThatThrownBy(() -> capturer.capture("c1", capturer.defaultOptions(ImageFormat.PNG)))
                    .isInstanceOf(CaptureChannel.CaptureException.class);
        }

        @Test
        @DisplayName("채널이 없으면 캡처할 수 없어야 한다")
        void shouldFailWithoutChannel() {
            // given
            ScreenshotCapturer noChannel = new ScreenshotCapturer(config, storage, null, FIXED_CLOCK);

            // then
            assertThatThrownBy(() -> noChannel.capture("c1", noChannel.defaultOptions(ImageFormat.PNG)))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("잘못된 체인 ID면 채널을 호출하지 않아야 한다")
        void shouldNotCaptureForInvalidChainId() {
            // then
            assertThatThrownBy(() -> capturer.capture("a/b", capturer.defaultOptions(ImageFormat.PNG)))
                    .isInstanceOf(IllegalArgumentException.class);
            verify(channel, never()).captureScreenshot(any());
        }

        @Test
        @DisplayName("기본 옵션은 설정의 타임아웃을 사용해야 한다")
        void shouldUseConfiguredTimeout() {
            // given
            EvidenceConfig custom = EvidenceConfig.builder().captureTimeoutMs(3000).build();

            // when
            ScreenshotOptions options = new ScreenshotCapturer(custom, storage, channel).defaultOptions(ImageFormat.JPEG);

            // then
            assertThat(options.getTimeoutMs()).isEqualTo(3000);
            assertThat(options.getFormat()).isEqualTo(ImageFormat.JPEG);
            assertThat(options.isFullPage()).isFalse();
        }
    }
}
