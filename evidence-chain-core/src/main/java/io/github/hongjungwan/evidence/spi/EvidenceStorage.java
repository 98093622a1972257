package io.github.hongjungwan.evidence.spi;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 증거 저장소 SPI. 키는 증거 루트 기준 '/' 구분 상대 경로.
 *
 * <p>구현체는 원자적 쓰기(부분 기록 노출 없음)와 키 단위 상호 배제를 보장해야 함.
 * 하나의 체인에 대한 읽기-수정-쓰기 직렬화는 호출자 책임.
 */
public interface EvidenceStorage {

    /** 키 내용 조회 (없으면 empty) */
    Optional<byte[]> read(String key);

    /** 원자적 쓰기 (기존 내용 교체) */
    void write(String key, byte[] data);

    /** 키 삭제 (삭제했으면 true, 원래 없었으면 false) */
    boolean delete(String key);

    boolean exists(String key);

    /** 네임스페이스 바로 아래 파일 이름 목록 (네임스페이스가 없으면 빈 목록) */
    List<String> list(String namespace);

    /** 외부 전달용 물리 위치 */
    Path locate(String key);

    /** 저장소 I/O 실패. 호출자에게 항상 전파됨. */
    class StorageException extends RuntimeException {
        public StorageException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
