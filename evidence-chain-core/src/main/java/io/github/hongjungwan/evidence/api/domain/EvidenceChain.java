package io.github.hongjungwan.evidence.api.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 실행 단위 증거 체인 스냅샷. append 시 새 스냅샷을 반환하며 기존 인스턴스는 변경하지 않음.
 *
 * <p>genesisHash는 생성 시 센티널이지만 첫 레코드 추가 시 그 레코드의 해시로 덮어씀.
 * 첫 레코드의 previousHash는 항상 센티널 (genesisHash와 혼동 금지).
 */
@Getter
@Builder(toBuilder = true)
@JsonDeserialize(builder = EvidenceChain.EvidenceChainBuilder.class)
public class EvidenceChain {

    private final String chainId;

    private final Instant createdAt;

    @Builder.Default
    private final List<EvidenceRecord> records = List.of();

    /** 첫 레코드 해시 (빈 체인이면 센티널) */
    private final String genesisHash;

    /** 마지막 레코드 해시 (빈 체인이면 센티널) */
    private final String headHash;

    private final int length;

    public List<EvidenceRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return records.isEmpty();
    }

    /** 레코드를 추가한 다음 스냅샷 */
    public EvidenceChain appended(EvidenceRecord record) {
        List<EvidenceRecord> next = new ArrayList<>(records);
        next.add(record);

        return toBuilder()
                .records(List.copyOf(next))
                .headHash(record.getRecordHash())
                .genesisHash(records.isEmpty() ? record.getRecordHash() : genesisHash)
                .length(next.size())
                .build();
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EvidenceChainBuilder {
    }
}
