package io.github.hongjungwan.evidence.core.internal;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.hongjungwan.evidence.api.domain.BreakReason;
import io.github.hongjungwan.evidence.api.domain.EvidenceChain;
import io.github.hongjungwan.evidence.api.domain.EvidenceRecord;
import io.github.hongjungwan.evidence.api.domain.VerificationResult;

import java.time.Clock;
import java.util.List;

/**
 * 체인 링크 검증. 센티널부터 순서대로 previousHash 링크와 레코드 해시를 확인, 첫 번째 끊긴 지점 보고.
 *
 * <p>저장소 없이 동작하므로 내보낸 파일을 외부에서 검증할 때도 그대로 사용.
 */
public class ChainVerifier {

    private final RecordHasher hasher;
    private final Clock clock;

    public ChainVerifier(RecordHasher hasher) {
        this(hasher, Clock.systemUTC());
    }

    public ChainVerifier(RecordHasher hasher, Clock clock) {
        this.hasher = hasher;
        this.clock = clock;
    }

    public VerificationResult verify(EvidenceChain chain) {
        List<EvidenceRecord> records = chain.getRecords();
        String expectedPrevious = RecordHasher.GENESIS_HASH;

        for (int i = 0; i < records.size(); i++) {
            EvidenceRecord record = records.get(i);

            if (!expectedPrevious.equals(record.getPreviousHash())) {
                return VerificationResult.broken(chain.getChainId(), records.size(), i,
                        BreakReason.LINK_MISMATCH, clock.instant());
            }
            if (!hasher.verify(record)) {
                return VerificationResult.broken(chain.getChainId(), records.size(), i,
                        BreakReason.HASH_MISMATCH, clock.instant());
            }
            expectedPrevious = record.getRecordHash();
        }

        return VerificationResult.valid(chain.getChainId(), records.size(), clock.instant());
    }

    /**
     * 저장된 체인 JSON을 바인딩 없이 검증. 타입이 맞지 않거나 필드가 추가된 레코드도 예외 없이 끊긴 지점으로 보고.
     */
    public VerificationResult verify(String chainId, JsonNode chainTree) {
        JsonNode records = chainTree == null ? null : chainTree.get("records");
        if (records == null || !records.isArray()) {
            return VerificationResult.broken(chainId, 0, 0, BreakReason.HASH_MISMATCH, clock.instant());
        }

        String expectedPrevious = RecordHasher.GENESIS_HASH;
        for (int i = 0; i < records.size(); i++) {
            JsonNode record = records.get(i);
            if (!record.isObject()) {
                return VerificationResult.broken(chainId, records.size(), i,
                        BreakReason.HASH_MISMATCH, clock.instant());
            }

            JsonNode previousHash = record.get("previousHash");
            if (previousHash == null || !previousHash.isTextual()
                    || !expectedPrevious.equals(previousHash.textValue())) {
                return VerificationResult.broken(chainId, records.size(), i,
                        BreakReason.LINK_MISMATCH, clock.instant());
            }

            JsonNode recordHash = record.get("recordHash");
            if (recordHash == null || !recordHash.isTextual()
                    || !recordHash.textValue().equals(hasher.digest(record))) {
                return VerificationResult.broken(chainId, records.size(), i,
                        BreakReason.HASH_MISMATCH, clock.instant());
            }
            expectedPrevious = recordHash.textValue();
        }

        return VerificationResult.valid(chainId, records.size(), clock.instant());
    }
}
