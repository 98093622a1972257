package io.github.hongjungwan.evidence.core.internal;

import io.github.hongjungwan.evidence.spi.EvidenceStorage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * 파일 시스템 증거 저장소. 임시 파일 기록 후 원자적 이동, 키 단위 잠금.
 */
@Slf4j
public class FileEvidenceStorage implements EvidenceStorage {

    private static final String TMP_PREFIX = ".tmp-";

    private final Path root;
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public FileEvidenceStorage(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public Optional<byte[]> read(String key) {
        Path path = locate(key);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to read evidence file: " + path, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void write(String key, byte[] data) {
        Path target = locate(key);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        Path tmp = null;
        try {
            Path parent = target.getParent();
            Files.createDirectories(parent);

            tmp = Files.createTempFile(parent, TMP_PREFIX, ".part");
            Files.write(tmp, data, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
            moveIntoPlace(tmp, target);
            tmp = null;

            log.debug("Written evidence file: {} ({} bytes)", target, data.length);
        } catch (IOException e) {
            throw new StorageException("Failed to write evidence file: " + target, e);
        } finally {
            deleteQuietly(tmp);
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        Path path = locate(key);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new StorageException("Failed to delete evidence file: " + path, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean exists(String key) {
        return Files.exists(locate(key));
    }

    @Override
    public List<String> list(String namespace) {
        Path dir = namespace == null || namespace.isEmpty() ? root : locate(namespace);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }

        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> !name.startsWith(TMP_PREFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Failed to list evidence namespace: " + dir, e);
        }
    }

    @Override
    public Path locate(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Storage key must not be blank");
        }
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("Storage key escapes evidence root: " + key);
        }
        return resolved;
    }

    public Path getRoot() {
        return root;
    }

    private ReentrantLock lockFor(String key) {
        return locks.computeIfAbsent(key, k -> new ReentrantLock());
    }

    private void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file: {}", tmp, e);
        }
    }
}
