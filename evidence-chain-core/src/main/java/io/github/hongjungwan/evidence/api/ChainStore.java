package io.github.hongjungwan.evidence.api;

import io.github.hongjungwan.evidence.api.domain.AppendRequest;
import io.github.hongjungwan.evidence.api.domain.EvidenceChain;
import io.github.hongjungwan.evidence.api.domain.EvidenceRecord;
import io.github.hongjungwan.evidence.api.domain.VerificationResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 증거 체인 저장소. 체인별 append-only 레코드 순서와 해시 링크를 관리.
 *
 * <p>같은 체인에 대한 동시 append는 호출자가 직렬화해야 함. 서로 다른 체인은 독립적.
 * 체인을 직접 영속화할 수 있는 유일한 컴포넌트.
 */
public interface ChainStore {

    /**
     * 빈 체인 생성 (genesisHash = headHash = 센티널).
     *
     * @throws ChainAlreadyExistsException 같은 ID의 체인이 이미 존재
     */
    EvidenceChain create(String chainId);

    /**
     * 레코드 추가. 실패 시 저장된 체인은 호출 전 상태 그대로 유지.
     *
     * @throws ChainNotFoundException 체인이 없음
     */
    EvidenceRecord append(String chainId, AppendRequest request);

    /** 체인 조회 (부수 효과 없음) */
    Optional<EvidenceChain> get(String chainId);

    /** 전체 체인 검증. 저장된 체인을 변경하지 않음. */
    VerificationResult verify(String chainId);

    /**
     * 독립 검증용 단독 파일로 내보내기.
     *
     * @return 내보낸 파일 위치
     * @throws ChainNotFoundException 체인이 없음
     */
    Path export(String chainId);

    /** 저장된 체인 ID 목록 (저장소가 비어 있으면 빈 목록) */
    List<String> list();

    class ChainNotFoundException extends RuntimeException {
        private final String chainId;

        public ChainNotFoundException(String chainId) {
            super("Evidence chain not found: " + chainId);
            this.chainId = chainId;
        }

        public String getChainId() {
            return chainId;
        }
    }

    class ChainAlreadyExistsException extends RuntimeException {
        public ChainAlreadyExistsException(String chainId) {
            super("Evidence chain already exists: " + chainId);
        }
    }
}
