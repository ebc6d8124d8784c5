package cn.bafuka.tagcache.store.impl;

import cn.bafuka.tagcache.exception.TagCacheException;
import cn.bafuka.tagcache.store.CacheEntry;
import cn.bafuka.tagcache.store.Store;
import cn.bafuka.tagcache.support.KeyHasher;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 文件 Store
 * 每个键一个文件，文件名为键的 SHA-256，内容为 8 字节过期时间 + 数据
 *
 * <p>写入先落临时文件再原子替换，读取无需加锁；
 * 修改同一个文件的操作按分段锁串行化。
 */
@Slf4j
public class FileStore implements Store {

    private static final String SUFFIX = ".cache";

    private static final int HEADER_BYTES = Long.BYTES;

    private static final int LOCK_STRIPES = 64;

    /**
     * 根目录
     */
    private final Path directory;

    /**
     * 时钟
     */
    private final Clock clock;

    /**
     * 分段锁
     */
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public FileStore(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new TagCacheException("无法创建缓存目录: " + directory, e, null,
                    TagCacheException.FailureReason.CONFIGURATION_ERROR);
        }
        log.info("构建文件 Store，目录: {}", directory);
    }

    @Override
    public byte[] get(String key) {
        Path file = pathFor(key);
        CacheEntry entry = read(key, file);
        if (entry == null) {
            return null;
        }

        if (entry.isExpired(clock.millis())) {
            evictIfExpired(key, file);
            return null;
        }
        return entry.getValue();
    }

    @Override
    public boolean set(String key, byte[] value, Duration ttl) {
        Path file = pathFor(key);
        long expiresAt = CacheEntry.expiresAt(ttl, clock);

        ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + value.length);
        buffer.putLong(expiresAt);
        buffer.put(value);

        ReentrantLock lock = lockFor(file);
        lock.lock();
        try {
            Path temp = Files.createTempFile(directory, "tc", ".tmp");
            try {
                Files.write(temp, buffer.array());
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
            return true;
        } catch (IOException e) {
            throw TagCacheException.backendUnavailable(getName(), key, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        Path file = pathFor(key);
        ReentrantLock lock = lockFor(file);
        lock.lock();
        try {
            Files.deleteIfExists(file);
            return true;
        } catch (IOException e) {
            throw TagCacheException.backendUnavailable(getName(), key, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean clear() {
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : stream) {
                ReentrantLock lock = lockFor(file);
                lock.lock();
                try {
                    if (Files.deleteIfExists(file)) {
                        removed++;
                    }
                } finally {
                    lock.unlock();
                }
            }
        } catch (IOException e) {
            throw TagCacheException.backendUnavailable(getName(), null, e);
        }
        log.info("文件 Store 已清空: directory={}, removed={}", directory, removed);
        return true;
    }

    @Override
    public boolean has(String key) {
        return get(key) != null;
    }

    @Override
    public String getName() {
        return "file";
    }

    public Path getDirectory() {
        return directory;
    }

    Path pathFor(String key) {
        return directory.resolve(KeyHasher.sha256Hex(key) + SUFFIX);
    }

    /**
     * 读取文件，文件不存在返回 null；头部不完整的文件视为损坏并删除
     */
    private CacheEntry read(String key, Path file) {
        byte[] raw;
        try {
            raw = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw TagCacheException.backendUnavailable(getName(), key, e);
        }

        if (raw.length < HEADER_BYTES) {
            log.warn("文件 Store 条目损坏，删除: key={}, file={}", key, file);
            delete(key);
            return null;
        }

        ByteBuffer buffer = ByteBuffer.wrap(raw);
        long expiresAt = buffer.getLong();
        byte[] value = new byte[raw.length - HEADER_BYTES];
        buffer.get(value);
        return new CacheEntry(value, expiresAt);
    }

    /**
     * 在锁内复查后删除过期文件，避免误删并发写入的新内容
     */
    private void evictIfExpired(String key, Path file) {
        ReentrantLock lock = lockFor(file);
        lock.lock();
        try {
            CacheEntry current = read(key, file);
            if (current != null && current.isExpired(clock.millis())) {
                Files.deleteIfExists(file);
                log.debug("文件 Store 条目已过期: key={}", key);
            }
        } catch (IOException e) {
            throw TagCacheException.backendUnavailable(getName(), key, e);
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(Path file) {
        return locks[Math.floorMod(file.getFileName().toString().hashCode(), LOCK_STRIPES)];
    }
}
