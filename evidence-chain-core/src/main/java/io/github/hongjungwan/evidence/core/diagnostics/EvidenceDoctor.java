package io.github.hongjungwan.evidence.core.diagnostics;

import io.github.hongjungwan.evidence.api.ChainStore;
import io.github.hongjungwan.evidence.api.config.EvidenceConfig;
import io.github.hongjungwan.evidence.api.domain.VerificationResult;
import io.github.hongjungwan.evidence.spi.EvidenceStorage;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * SDK 자가 진단. 저장소 쓰기 가능 여부, 해시 알고리즘, 저장된 체인 무결성 검사.
 */
@Slf4j
public class EvidenceDoctor {

    private static final String WRITE_CHECK_KEY = ".doctor-write-check";
    private static final byte[] WRITE_CHECK_CONTENT = "evidence-doctor".getBytes(StandardCharsets.UTF_8);

    private final EvidenceConfig config;
    private final EvidenceStorage storage;
    private final ChainStore chainStore;

    public EvidenceDoctor(EvidenceConfig config, EvidenceStorage storage, ChainStore chainStore) {
        this.config = config;
        this.storage = storage;
        this.chainStore = chainStore;
    }

    /** 모든 진단 검사 실행 */
    public DiagnosticReport diagnose() {
        log.info("Running evidence chain diagnostic checks...");

        List<DiagnosticResult> results = new ArrayList<>();
        results.add(checkDiskWritePermission());
        results.add(checkHashAlgorithm());
        if (config.isVerifyOnStartup()) {
            results.add(checkChainIntegrity());
        }

        DiagnosticReport report = new DiagnosticReport(results);

        if (report.hasFailures()) {
            log.warn("Diagnostic failures detected:");
            report.failedChecks().forEach(result ->
                    log.warn("  - {}: {}", result.name(), result.message())
            );
        } else {
            log.info("All diagnostic checks passed successfully");
        }

        return report;
    }

    /** 검사 1: 실제 사용하는 저장소에 쓰고 읽고 지울 수 있는지 */
    private DiagnosticResult checkDiskWritePermission() {
        try {
            storage.write(WRITE_CHECK_KEY, WRITE_CHECK_CONTENT);
            byte[] content = storage.read(WRITE_CHECK_KEY).orElse(null);
            storage.delete(WRITE_CHECK_KEY);

            if (Arrays.equals(WRITE_CHECK_CONTENT, content)) {
                return DiagnosticResult.success("Disk Write Permission",
                        "Evidence storage writable: " + storage.locate(WRITE_CHECK_KEY).getParent());
            }
            return DiagnosticResult.failure("Disk Write Permission", "Write verification failed");

        } catch (RuntimeException e) {
            return DiagnosticResult.failure("Disk Write Permission",
                    "Cannot write to evidence storage: " + e.getMessage());
        }
    }

    /** 검사 2: SHA-256 사용 가능 여부 */
    private DiagnosticResult checkHashAlgorithm() {
        try {
            MessageDigest.getInstance("SHA-256");
            return DiagnosticResult.success("Hash Algorithm", "SHA-256 available");
        } catch (NoSuchAlgorithmException e) {
            return DiagnosticResult.failure("Hash Algorithm", "SHA-256 not available: " + e.getMessage());
        }
    }

    /** 검사 3: 저장된 체인 전체 검증 */
    private DiagnosticResult checkChainIntegrity() {
        try {
            List<String> chainIds = chainStore.list();
            List<String> broken = new ArrayList<>();

            for (String chainId : chainIds) {
                VerificationResult result = chainStore.verify(chainId);
                if (!result.isValid()) {
                    broken.add(chainId + " (" + result.getMessage() + ")");
                }
            }

            if (broken.isEmpty()) {
                return DiagnosticResult.success("Chain Integrity",
                        chainIds.size() + " chain(s) verified");
            }
            return DiagnosticResult.failure("Chain Integrity", "Broken chains: " + String.join(", ", broken));

        } catch (RuntimeException e) {
            return DiagnosticResult.warning("Chain Integrity",
                    "Could not verify stored chains: " + e.getMessage());
        }
    }

    /** 진단 결과 */
    public record DiagnosticResult(String name, Status status, String message) {

        public enum Status {
            SUCCESS, WARNING, FAILURE
        }

        public static DiagnosticResult success(String name, String message) {
            return new DiagnosticResult(name, Status.SUCCESS, message);
        }

        public static DiagnosticResult warning(String name, String message) {
            return new DiagnosticResult(name, Status.WARNING, message);
        }

        public static DiagnosticResult failure(String name, String message) {
            return new DiagnosticResult(name, Status.FAILURE, message);
        }

        public boolean isFailure() {
            return status == Status.FAILURE;
        }
    }

    /** 진단 리포트 */
    public record DiagnosticReport(List<DiagnosticResult> results) {

        public DiagnosticReport {
            results = List.copyOf(results);
        }

        public boolean hasFailures() {
            return results.stream().anyMatch(DiagnosticResult::isFailure);
        }

        public List<DiagnosticResult> failedChecks() {
            return results.stream()
                    .filter(DiagnosticResult::isFailure)
                    .toList();
        }
    }
}
