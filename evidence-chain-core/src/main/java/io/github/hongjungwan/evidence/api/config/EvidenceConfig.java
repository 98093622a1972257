package io.github.hongjungwan.evidence.api.config;

import lombok.Builder;
import lombok.Getter;

/**
 * SDK 설정. 증거 저장 경로, 네임스페이스, 직렬화, 캡처 채널 설정 포함.
 */
@Getter
@Builder
public class EvidenceConfig {

    /** 증거 루트 디렉토리 (체인 파일이 바로 아래 저장됨) */
    @Builder.Default
    private final String evidenceDirectory = "evidence";

    /** 내보내기 네임스페이스 */
    @Builder.Default
    private final String exportsNamespace = "exports";

    /** 스크린샷 네임스페이스 (하위에 체인 ID별 디렉토리) */
    @Builder.Default
    private final String screenshotsNamespace = "screenshots";

    /** 체인 JSON 들여쓰기 여부 */
    @Builder.Default
    private final boolean prettyPrint = true;

    /** 캡처 채널 응답 대기 시간 (ms) */
    @Builder.Default
    private final long captureTimeoutMs = 15_000;

    /** 시작 시 전체 체인 검증 여부 */
    @Builder.Default
    private final boolean verifyOnStartup = true;

    /** 개발용 기본 설정 */
    public static EvidenceConfig defaultConfig() {
        return EvidenceConfig.builder().build();
    }
}
