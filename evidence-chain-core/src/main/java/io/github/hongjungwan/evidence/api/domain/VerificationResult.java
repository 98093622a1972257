package io.github.hongjungwan.evidence.api.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 체인 검증 결과. 깨진 체인은 예외가 아니라 보고 대상 데이터.
 */
@Getter
@Builder
@ToString
public class VerificationResult {

    private final String chainId;

    private final boolean valid;

    private final int recordCount;

    /** 첫 번째 깨진 레코드 인덱스 (유효하면 null) */
    private final Integer brokenAt;

    /** 실패 사유 (유효하면 null) */
    private final BreakReason reason;

    /** 표시용 메시지 */
    private final String message;

    private final Instant verifiedAt;

    public static VerificationResult valid(String chainId, int recordCount, Instant verifiedAt) {
        return VerificationResult.builder()
                .chainId(chainId)
                .valid(true)
                .recordCount(recordCount)
                .message("chain integrity verified (" + recordCount + " records)")
                .verifiedAt(verifiedAt)
                .build();
    }

    public static VerificationResult broken(String chainId, int recordCount, int brokenAt,
                                            BreakReason reason, Instant verifiedAt) {
        return VerificationResult.builder()
                .chainId(chainId)
                .valid(false)
                .recordCount(recordCount)
                .brokenAt(brokenAt)
                .reason(reason)
                .message("chain broken at record " + brokenAt + ": " + reason.getDescription())
                .verifiedAt(verifiedAt)
                .build();
    }

    public static VerificationResult notFound(String chainId, Instant verifiedAt) {
        return VerificationResult.builder()
                .chainId(chainId)
                .valid(false)
                .recordCount(0)
                .reason(BreakReason.CHAIN_NOT_FOUND)
                .message("chain not found: " + chainId)
                .verifiedAt(verifiedAt)
                .build();
    }
}
