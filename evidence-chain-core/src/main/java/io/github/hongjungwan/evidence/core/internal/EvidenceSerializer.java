package io.github.hongjungwan.evidence.core.internal;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.hongjungwan.evidence.api.domain.EvidenceChain;

import java.io.IOException;

/**
 * 체인 JSON 직렬화. 체인 파일과 내보내기 파일이 같은 스키마 사용.
 */
public class EvidenceSerializer {

    private final ObjectMapper objectMapper;

    public EvidenceSerializer() {
        this(true);
    }

    public EvidenceSerializer(boolean prettyPrint) {
        this.objectMapper = createObjectMapper(prettyPrint);
    }

    /**
     * 체인 파일과 해시 정규화가 공유하는 매퍼 설정.
     *
     * <p>소수는 BigDecimal 원문 그대로, 문자열-숫자 등 스칼라 강제 변환은 거부.
     */
    static ObjectMapper createObjectMapper(boolean prettyPrint) {
        JsonMapper.Builder builder = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .nodeFactory(JsonNodeFactory.withExactBigDecimals(true))
                .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false)
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS);
        if (prettyPrint) {
            builder.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return builder.build();
    }

    public byte[] writeChain(EvidenceChain chain) {
        try {
            return objectMapper.writeValueAsBytes(chain);
        } catch (IOException e) {
            throw new SerializationException("Failed to serialize evidence chain: " + chain.getChainId(), e);
        }
    }

    public EvidenceChain readChain(byte[] data) {
        try {
            return objectMapper.readValue(data, EvidenceChain.class);
        } catch (IOException e) {
            throw new SerializationException("Failed to deserialize evidence chain", e);
        }
    }

    /** 바인딩 없이 JSON 트리로 읽기 (저장된 표현 그대로 검증할 때 사용) */
    public JsonNode readTree(byte[] data) {
        try {
            return objectMapper.readTree(data);
        } catch (IOException e) {
            throw new SerializationException("Failed to parse evidence chain", e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public static class SerializationException extends RuntimeException {
        public SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
