package io.github.hongjungwan.evidence.core.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hongjungwan.evidence.api.domain.EvidenceRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 레코드 해시 계산. 정규화 JSON(모든 깊이에서 키 정렬, 공백 없음)의 SHA-256.
 *
 * <p>해시 입력: id, chainId, sourceUrl, extractedAt, extractedValue, anchors, screenshot, previousHash.
 * previousHash가 빠지면 링크 변조를 감지할 수 없으므로 생략 가능한 필드 없음.
 */
public class RecordHasher {

    /** 첫 레코드의 previousHash (256비트 0) */
    public static final String GENESIS_HASH = "0000000000000000000000000000000000000000000000000000000000000000";

    private static final String HASH_ALGORITHM = "SHA-256";

    private static final String RECORD_HASH_FIELD = "recordHash";

    private static final ObjectMapper CANONICAL_MAPPER = EvidenceSerializer.createObjectMapper(false);

    /** previousHash를 연결한 레코드 해시 (record의 recordHash, previousHash 필드는 무시) */
    public String digest(EvidenceRecord record, String previousHash) {
        String canonical = canonicalize(record, previousHash);
        return sha256Hex(canonical.getBytes(StandardCharsets.UTF_8));
    }

    /** 레코드 자신의 previousHash로 재계산하여 저장된 해시와 비교 */
    public boolean verify(EvidenceRecord record) {
        if (record.getRecordHash() == null) {
            return false;
        }
        String recomputed = digest(record, record.getPreviousHash());
        return recomputed.equals(record.getRecordHash());
    }

    /**
     * 저장된 레코드 JSON 그대로의 해시. recordHash 필드만 빼고 나머지 전부(알 수 없는 필드 포함)가 입력.
     *
     * <p>변조되지 않은 레코드라면 {@link #digest(EvidenceRecord, String)}와 같은 값.
     */
    public String digest(JsonNode recordNode) {
        if (recordNode == null || !recordNode.isObject()) {
            throw new IllegalArgumentException("Record node must be a JSON object");
        }
        ObjectNode fields = ((ObjectNode) recordNode).deepCopy();
        fields.remove(RECORD_HASH_FIELD);
        return sha256Hex(toCanonicalString(fields).getBytes(StandardCharsets.UTF_8));
    }

    /** 해시 입력 정규화 문자열 */
    public String canonicalize(EvidenceRecord record, String previousHash) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", record.getId());
        fields.put("chainId", record.getChainId());
        fields.put("sourceUrl", record.getSourceUrl());
        fields.put("extractedAt", record.getExtractedAt());
        fields.put("extractedValue", record.getExtractedValue() == null
                ? NullNode.getInstance() : record.getExtractedValue());
        fields.put("anchors", record.getAnchors());
        fields.put("screenshot", record.getScreenshot());
        fields.put("previousHash", previousHash);

        try {
            // 저장 후 다시 읽었을 때와 같은 숫자 표현이 되도록 한 번 파싱을 거침
            JsonNode tree = CANONICAL_MAPPER.readTree(CANONICAL_MAPPER.writeValueAsBytes(fields));
            return toCanonicalString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record is not serializable: " + record.getId(), e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to canonicalize record: " + record.getId(), e);
        }
    }

    private static String toCanonicalString(JsonNode tree) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(sortKeys(tree));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write canonical JSON", e);
        }
    }

    public static String sha256Hex(byte[] data) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(HASH_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Hash algorithm not available: " + HASH_ALGORITHM, e);
        }
        return HexFormat.of().formatHex(digest.digest(data));
    }

    private static JsonNode sortKeys(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);

            ObjectNode sorted = CANONICAL_MAPPER.createObjectNode();
            for (String name : names) {
                sorted.set(name, sortKeys(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = CANONICAL_MAPPER.createArrayNode();
            for (JsonNode element : node) {
                array.add(sortKeys(element));
            }
            return array;
        }
        return node;
    }
}
