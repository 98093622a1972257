package io.github.hongjungwan.evidence.starter;

import io.github.hongjungwan.evidence.api.ChainStore;
import io.github.hongjungwan.evidence.api.config.EvidenceConfig;
import io.github.hongjungwan.evidence.core.diagnostics.EvidenceDoctor;
import io.github.hongjungwan.evidence.core.internal.AnchorBuilder;
import io.github.hongjungwan.evidence.core.internal.DefaultChainStore;
import io.github.hongjungwan.evidence.core.internal.EvidenceSerializer;
import io.github.hongjungwan.evidence.core.internal.FileEvidenceStorage;
import io.github.hongjungwan.evidence.core.internal.RecordHasher;
import io.github.hongjungwan.evidence.core.internal.ScreenshotCapturer;
import io.github.hongjungwan.evidence.spi.CaptureChannel;
import io.github.hongjungwan.evidence.spi.EvidenceStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;

import java.nio.file.Paths;

/**
 * Evidence Chain SDK Spring Boot 자동 설정.
 */
@AutoConfiguration
@EnableConfigurationProperties(EvidenceChainProperties.class)
@ConditionalOnProperty(prefix = "evidence-chain", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class EvidenceChainAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public EvidenceConfig evidenceConfig(EvidenceChainProperties properties) {
        return EvidenceConfig.builder()
                .evidenceDirectory(properties.getEvidenceDirectory())
                .exportsNamespace(properties.getExportsNamespace())
                .screenshotsNamespace(properties.getScreenshotsNamespace())
                .prettyPrint(properties.isPrettyPrint())
                .captureTimeoutMs(properties.getCapture().getTimeoutMs())
                .verifyOnStartup(properties.isVerifyOnStartup())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public EvidenceStorage evidenceStorage(EvidenceConfig config) {
        return new FileEvidenceStorage(Paths.get(config.getEvidenceDirectory()));
    }

    @Bean
    @ConditionalOnMissingBean
    public EvidenceSerializer evidenceSerializer(EvidenceConfig config) {
        return new EvidenceSerializer(config.isPrettyPrint());
    }

    @Bean
    @ConditionalOnMissingBean
    public RecordHasher recordHasher() {
        return new RecordHasher();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChainStore chainStore(
            EvidenceConfig config,
            EvidenceStorage storage,
            EvidenceSerializer serializer,
            RecordHasher hasher
    ) {
        return new DefaultChainStore(config, storage, serializer, hasher);
    }

    @Bean
    @ConditionalOnMissingBean
    public AnchorBuilder anchorBuilder() {
        return new AnchorBuilder();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScreenshotCapturer screenshotCapturer(
            EvidenceConfig config,
            EvidenceStorage storage,
            ObjectProvider<CaptureChannel> channel
    ) {
        CaptureChannel captureChannel = channel.getIfAvailable();
        if (captureChannel == null) {
            log.info("No CaptureChannel bean found - screenshots accepted as raw bytes only");
        }
        return new ScreenshotCapturer(config, storage, captureChannel);
    }

    @Bean
    @ConditionalOnMissingBean
    public EvidenceDoctor evidenceDoctor(EvidenceConfig config, EvidenceStorage storage, ChainStore chainStore) {
        return new EvidenceDoctor(config, storage, chainStore);
    }

    @Bean
    public EvidenceChainLifecycle evidenceChainLifecycle(EvidenceDoctor doctor, EvidenceConfig config) {
        return new EvidenceChainLifecycle(doctor, config);
    }

    /**
     * 시작 시 자가 진단을 실행하는 SmartLifecycle 구현체.
     */
    static class EvidenceChainLifecycle implements SmartLifecycle {

        private final EvidenceDoctor doctor;
        private final EvidenceConfig config;
        private volatile boolean running = false;
        private volatile EvidenceDoctor.DiagnosticReport lastReport;

        EvidenceChainLifecycle(EvidenceDoctor doctor, EvidenceConfig config) {
            this.doctor = doctor;
            this.config = config;
        }

        @Override
        public void start() {
            log.info("Starting Evidence Chain SDK (evidence directory: {})", config.getEvidenceDirectory());

            lastReport = doctor.diagnose();
            if (lastReport.hasFailures()) {
                log.warn("Diagnostic failures detected - stored evidence may not be trustworthy");
            }

            running = true;
            log.info("Evidence Chain SDK started");
        }

        @Override
        public void stop() {
            running = false;
            log.info("Evidence Chain SDK stopped");
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public int getPhase() {
            return Integer.MIN_VALUE + 100;
        }

        EvidenceDoctor.DiagnosticReport getLastReport() {
            return lastReport;
        }
    }
}
