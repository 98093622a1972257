package io.github.hongjungwan.evidence.api.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * 증거 레코드. 어떤 값을 어디서 언제 추출했는지 증명하는 체인의 기본 단위.
 *
 * <p>recordHash는 나머지 모든 필드(previousHash 포함)의 순수 함수. 생성 후 변경 불가.
 */
@Getter
@Builder(toBuilder = true)
@JsonDeserialize(builder = EvidenceRecord.EvidenceRecordBuilder.class)
public class EvidenceRecord {

    /** 레코드 식별자 (UUID) */
    private final String id;

    /** 소속 체인 ID */
    private final String chainId;

    /** 추출 출처 URL */
    private final String sourceUrl;

    /** 추출 시각 */
    private final Instant extractedAt;

    /** 추출 값 (임의 구조의 JSON 값) */
    private final JsonNode extractedValue;

    /** 재탐색용 앵커 (1개 이상) */
    private final List<DomAnchor> anchors;

    /** 스크린샷 메타데이터 (없으면 null) */
    private final ScreenshotMeta screenshot;

    /** 이 레코드의 SHA-256 (hex) */
    private final String recordHash;

    /** 직전 레코드 해시 또는 제네시스 센티널 */
    private final String previousHash;

    @JsonPOJOBuilder(withPrefix = "")
    public static class EvidenceRecordBuilder {
    }
}
