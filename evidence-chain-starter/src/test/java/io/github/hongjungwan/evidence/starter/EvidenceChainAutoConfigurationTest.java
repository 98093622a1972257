package io.github.hongjungwan.evidence.starter;

import io.github.hongjungwan.evidence.api.ChainStore;
import io.github.hongjungwan.evidence.api.config.EvidenceConfig;
import io.github.hongjungwan.evidence.api.domain.ImageFormat;
import io.github.hongjungwan.evidence.api.domain.ScreenshotMeta;
import io.github.hongjungwan.evidence.core.diagnostics.EvidenceDoctor;
import io.github.hongjungwan.evidence.core.internal.AnchorBuilder;
import io.github.hongjungwan.evidence.core.internal.ScreenshotCapturer;
import io.github.hongjungwan.evidence.spi.CaptureChannel;
import io.github.hongjungwan.evidence.spi.EvidenceStorage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("EvidenceChainAutoConfiguration 테스트")
class EvidenceChainAutoConfigurationTest {

    @TempDir
    Path tempDir;

    private ApplicationContextRunner runner() {
        return new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(EvidenceChainAutoConfiguration.class))
                .withPropertyValues("evidence-chain.evidence-directory=" + tempDir);
    }

    @Test
    @DisplayName("기본 설정으로 SDK 빈을 모두 등록해야 한다")
    void shouldRegisterSdkBeans() {
        runner().run(context -> {
            assertThat(context).hasSingleBean(EvidenceConfig.class);
            assertThat(context).hasSingleBean(EvidenceStorage.class);
            assertThat(context).hasSingleBean(ChainStore.class);
            assertThat(context).hasSingleBean(AnchorBuilder.class);
            assertThat(context).hasSingleBean(ScreenshotCapturer.class);
            assertThat(context).hasSingleBean(EvidenceDoctor.class);
        });
    }

    @Test
    @DisplayName("Properties 값을 EvidenceConfig에 반영해야 한다")
    void shouldBindProperties() {
        runner()
                .withPropertyValues(
                        "evidence-chain.pretty-print=false",
                        "evidence-chain.exports-namespace=out",
                        "evidence-chain.capture.timeout-ms=2500",
                        "evidence-chain.verify-on-startup=false")
                .run(context -> {
                    EvidenceConfig config = context.getBean(EvidenceConfig.class);
                    assertThat(config.getEvidenceDirectory()).isEqualTo(tempDir.toString());
                    assertThat(config.isPrettyPrint()).isFalse();
                    assertThat(config.getExportsNamespace()).isEqualTo("out");
                    assertThat(config.getCaptureTimeoutMs()).isEqualTo(2500L);
                    assertThat(config.isVerifyOnStartup()).isFalse();
                });
    }

    @Test
    @DisplayName("enabled=false이면 빈을 등록하지 않아야 한다")
    void shouldBackOffWhenDisabled() {
        runner()
                .withPropertyValues("evidence-chain.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(ChainStore.class));
    }

    @Test
    @DisplayName("시작 시 자가 진단을 실행해야 한다")
    void shouldRunDiagnosticsOnStart() {
        runner().run(context -> {
            EvidenceChainAutoConfiguration.EvidenceChainLifecycle lifecycle =
                    context.getBean(EvidenceChainAutoConfiguration.EvidenceChainLifecycle.class);
            assertThat(lifecycle.isRunning()).isTrue();
            assertThat(lifecycle.getLastReport()).isNotNull();
            assertThat(lifecycle.getLastReport().hasFailures()).isFalse();
        });
    }

    @Test
    @DisplayName("등록된 체인 저장소로 체인을 만들고 검증할 수 있어야 한다")
    void shouldWireWorkingChainStore() {
        runner().run(context -> {
            ChainStore store = context.getBean(ChainStore.class);
            store.create("boot-run");

            assertThat(store.list()).containsExactly("boot-run");
            assertThat(store.verify("boot-run").isValid()).isTrue();
            assertThat(tempDir.resolve("chain-boot-run.json")).exists();
        });
    }

    @Test
    @DisplayName("CaptureChannel 빈이 있으면 ScreenshotCapturer에 연결해야 한다")
    void shouldUseCaptureChannelBean() {
        // given
        byte[] png = new byte[24];
        png[19] = 4;
        png[23] = 3;
        CaptureChannel channel = mock(CaptureChannel.class);
        when(channel.getName()).thenReturn("test-channel");
        when(channel.captureScreenshot(any())).thenReturn(Base64.getEncoder().encodeToString(png));

        runner()
                .withBean(CaptureChannel.class, () -> channel)
                .run(context -> {
                    ScreenshotCapturer capturer = context.getBean(ScreenshotCapturer.class);

                    // when
                    ScreenshotMeta meta = capturer.capture("boot-run", capturer.defaultOptions(ImageFormat.PNG));

                    // then
                    assertThat(meta.getWidth()).isEqualTo(4);
                    assertThat(meta.getHeight()).isEqualTo(3);
                    assertThat(tempDir.resolve(meta.getPath())).exists();
                });
    }

    @Test
    @DisplayName("사용자 정의 빈이 있으면 기본 빈을 대체하지 않아야 한다")
    void shouldRespectUserDefinedBeans() {
        EvidenceConfig custom = EvidenceConfig.builder()
                .evidenceDirectory(tempDir.resolve("custom").toString())
                .build();

        runner()
                .withBean(EvidenceConfig.class, () -> custom)
                .run(context -> assertThat(context.getBean(EvidenceConfig.class)).isSameAs(custom));
    }
}
