package io.github.hongjungwan.evidence.starter;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Evidence Chain SDK 설정 Properties (prefix: evidence-chain).
 */
@Data
@ConfigurationProperties(prefix = "evidence-chain")
public class EvidenceChainProperties {

    /** SDK 활성화 여부 */
    private boolean enabled = true;

    /** 체인 파일 저장 루트 디렉토리 */
    private String evidenceDirectory = "evidence";

    /** 내보내기 파일 하위 디렉토리 */
    private String exportsNamespace = "exports";

    /** 스크린샷 하위 디렉토리 */
    private String screenshotsNamespace = "screenshots";

    /** 체인 JSON 들여쓰기 */
    private boolean prettyPrint = true;

    /** 시작 시 저장된 체인 전체 검증 */
    private boolean verifyOnStartup = true;

    /** 캡처 설정 */
    private CaptureProperties capture = new CaptureProperties();

    @Data
    public static class CaptureProperties {
        /** 스크린샷 캡처 타임아웃 (ms) */
        private long timeoutMs = 15_000;
    }
}
