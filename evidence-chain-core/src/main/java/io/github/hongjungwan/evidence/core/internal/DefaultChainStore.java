package io.github.hongjungwan.evidence.core.internal;

import com.fasterxml.jackson.databind.node.NullNode;
import io.github.hongjungwan.evidence.api.ChainStore;
import io.github.hongjungwan.evidence.api.config.EvidenceConfig;
import io.github.hongjungwan.evidence.api.domain.AppendRequest;
import io.github.hongjungwan.evidence.api.domain.EvidenceChain;
import io.github.hongjungwan.evidence.api.domain.EvidenceRecord;
import io.github.hongjungwan.evidence.api.domain.VerificationResult;
import io.github.hongjungwan.evidence.spi.EvidenceStorage;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 저장소 기반 ChainStore 구현. 체인당 파일 하나 (chain-&lt;id&gt;.json).
 *
 * <p>내부 잠금 없음. 같은 체인의 append는 호출자가 직렬화.
 */
@Slf4j
public class DefaultChainStore implements ChainStore {

    private static final String CHAIN_PREFIX = "chain-";
    private static final String CHAIN_SUFFIX = ".json";

    private final EvidenceConfig config;
    private final EvidenceStorage storage;
    private final EvidenceSerializer serializer;
    private final RecordHasher hasher;
    private final ChainVerifier verifier;
    private final Clock clock;

    public DefaultChainStore(EvidenceConfig config, EvidenceStorage storage,
                             EvidenceSerializer serializer, RecordHasher hasher) {
        this(config, storage, serializer, hasher, Clock.systemUTC());
    }

    public DefaultChainStore(EvidenceConfig config, EvidenceStorage storage,
                             EvidenceSerializer serializer, RecordHasher hasher, Clock clock) {
        this.config = config;
        this.storage = storage;
        this.serializer = serializer;
        this.hasher = hasher;
        this.verifier = new ChainVerifier(hasher, clock);
        this.clock = clock;
    }

    @Override
    public EvidenceChain create(String chainId) {
        String key = chainKey(chainId);
        if (storage.exists(key)) {
            throw new ChainAlreadyExistsException(chainId);
        }

        log.info("Creating evidence chain: {}", chainId);

        EvidenceChain chain = EvidenceChain.builder()
                .chainId(chainId)
                .createdAt(now())
                .records(List.of())
                .genesisHash(RecordHasher.GENESIS_HASH)
                .headHash(RecordHasher.GENESIS_HASH)
                .length(0)
                .build();

        save(chain);
        return chain;
    }

    @Override
    public EvidenceRecord append(String chainId, AppendRequest request) {
        validate(request);

        EvidenceChain chain = get(chainId).orElseThrow(() -> new ChainNotFoundException(chainId));
        String previousHash = chain.getHeadHash();

        EvidenceRecord unsealed = EvidenceRecord.builder()
                .id(UUID.randomUUID().toString())
                .chainId(chainId)
                .sourceUrl(request.getSourceUrl())
                .extractedAt(now())
                .extractedValue(request.getExtractedValue() == null
                        ? NullNode.getInstance() : request.getExtractedValue())
                .anchors(List.copyOf(request.getAnchors()))
                .screenshot(request.getScreenshot())
                .previousHash(previousHash)
                .build();

        EvidenceRecord record = unsealed.toBuilder()
                .recordHash(hasher.digest(unsealed, previousHash))
                .build();

        EvidenceChain next = chain.appended(record);
        save(next);

        log.info("Evidence record appended: chainId={}, recordId={}, length={}",
                chainId, record.getId(), next.getLength());
        return record;
    }

    @Override
    public Optional<EvidenceChain> get(String chainId) {
        return storage.read(chainKey(chainId)).map(serializer::readChain);
    }

    @Override
    public VerificationResult verify(String chainId) {
        Optional<byte[]> stored = storage.read(chainKey(chainId));
        if (stored.isEmpty()) {
            log.warn("Cannot verify - evidence chain not found: {}", chainId);
            return VerificationResult.notFound(chainId, now());
        }

        // 모델로 바인딩하지 않고 저장된 JSON 그대로 검증
        VerificationResult result = verifier.verify(chainId, serializer.readTree(stored.get()));
        if (result.isValid()) {
            log.info("Evidence chain verified: chainId={}, records={}", chainId, result.getRecordCount());
        } else {
            log.warn("Evidence chain {} - {}", chainId, result.getMessage());
        }
        return result;
    }

    @Override
    public Path export(String chainId) {
        EvidenceChain chain = get(chainId).orElseThrow(() -> new ChainNotFoundException(chainId));

        String key = config.getExportsNamespace() + "/" + CHAIN_PREFIX + chainId + "-"
                + TimestampNames.of(now()) + CHAIN_SUFFIX;
        storage.write(key, serializer.writeChain(chain));

        Path exported = storage.locate(key);
        log.info("Evidence chain exported: chainId={}, path={}", chainId, exported);
        return exported;
    }

    @Override
    public List<String> list() {
        return storage.list("").stream()
                .filter(name -> name.startsWith(CHAIN_PREFIX) && name.endsWith(CHAIN_SUFFIX))
                .map(name -> name.substring(CHAIN_PREFIX.length(), name.length() - CHAIN_SUFFIX.length()))
                .sorted()
                .toList();
    }

    private void save(EvidenceChain chain) {
        storage.write(chainKey(chain.getChainId()), serializer.writeChain(chain));
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static String chainKey(String chainId) {
        return CHAIN_PREFIX + ChainIds.requireValid(chainId) + CHAIN_SUFFIX;
    }

    private static void validate(AppendRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Append request must not be null");
        }
        if (request.getSourceUrl() == null || request.getSourceUrl().isBlank()) {
            throw new IllegalArgumentException("sourceUrl must not be blank");
        }
        if (request.getAnchors() == null || request.getAnchors().isEmpty()) {
            throw new IllegalArgumentException("At least one anchor is required");
        }
    }
}
