package io.github.hongjungwan.evidence.api.domain;

/**
 * 체인 검증 실패 사유.
 */
public enum BreakReason {

    /** previousHash가 직전 레코드 해시와 불일치 */
    LINK_MISMATCH("link mismatch"),

    /** 재계산한 해시가 저장된 recordHash와 불일치 */
    HASH_MISMATCH("hash mismatch"),

    CHAIN_NOT_FOUND("chain not found");

    private final String description;

    BreakReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
