package io.github.hongjungwan.evidence.api;

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

import java.nio.file.Paths;

/**
 * SDK 컴포넌트 조립. 프로세스 시작 시 한 번 생성해 호출자에게 전달 (전역 싱글톤 없음).
 */
public final class EvidenceChainSdk {

    private final EvidenceConfig config;
    private final EvidenceStorage storage;
    private final ChainStore chainStore;
    private final AnchorBuilder anchorBuilder;
    private final ScreenshotCapturer screenshotCapturer;
    private final EvidenceDoctor doctor;

    private EvidenceChainSdk(EvidenceConfig config, EvidenceStorage storage, CaptureChannel channel) {
        this.config = config;
        this.storage = storage;
        this.chainStore = new DefaultChainStore(config, storage,
                new EvidenceSerializer(config.isPrettyPrint()), new RecordHasher());
        this.anchorBuilder = new AnchorBuilder();
        this.screenshotCapturer = new ScreenshotCapturer(config, storage, channel);
        this.doctor = new EvidenceDoctor(config, storage, chainStore);
    }

    /** 파일 저장소 기반 SDK (캡처 채널 없음) */
    public static EvidenceChainSdk create(EvidenceConfig config) {
        return create(config, null);
    }

    public static EvidenceChainSdk create(EvidenceConfig config, CaptureChannel channel) {
        return create(config, new FileEvidenceStorage(Paths.get(config.getEvidenceDirectory())), channel);
    }

    public static EvidenceChainSdk create(EvidenceConfig config, EvidenceStorage storage, CaptureChannel channel) {
        return new EvidenceChainSdk(config, storage, channel);
    }

    public EvidenceConfig getConfig() {
        return config;
    }

    public EvidenceStorage getStorage() {
        return storage;
    }

    public ChainStore getChainStore() {
        return chainStore;
    }

    public AnchorBuilder getAnchorBuilder() {
        return anchorBuilder;
    }

    public ScreenshotCapturer getScreenshotCapturer() {
        return screenshotCapturer;
    }

    public EvidenceDoctor getDoctor() {
        return doctor;
    }
}
