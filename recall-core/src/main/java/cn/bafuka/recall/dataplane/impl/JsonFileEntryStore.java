package cn.bafuka.recall.dataplane.impl;

import cn.bafuka.recall.core.CacheEntry;
import cn.bafuka.recall.core.CacheStats;
import cn.bafuka.recall.core.CacheStore;
import cn.bafuka.recall.dataplane.EntryStore;
import cn.bafuka.recall.dataplane.SnapshotLoadResult;
import cn.bafuka.recall.dataplane.SnapshotLoadResult.Status;
import cn.bafuka.recall.dataplane.SnapshotLock;
import cn.bafuka.recall.dataplane.TtlPolicy;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.parser.Feature;
import com.alibaba.fastjson.serializer.SerializerFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 基于 JSON 文件的条目存储
 *
 * 读：文件缺失、JSON 损坏、I/O 错误都降级为空快照；读取后立即清理过期条目（不计入未命中）。
 * 写：先写同目录临时文件，再原子替换，避免并发读者看到写了一半的快照。
 */
@Slf4j
public class JsonFileEntryStore implements EntryStore {

    private final Path snapshotFile;

    private final Path lockFile;

    private final TtlPolicy ttlPolicy;

    private final long ttlSeconds;

    private final long lockTimeoutMs;

    private final Clock clock;

    public JsonFileEntryStore(Path snapshotFile, TtlPolicy ttlPolicy, long ttlSeconds,
                              long lockTimeoutMs, Clock clock) {
        this.snapshotFile = snapshotFile;
        this.lockFile = snapshotFile.resolveSibling(snapshotFile.getFileName() + ".lock");
        this.ttlPolicy = ttlPolicy;
        this.ttlSeconds = ttlSeconds;
        this.lockTimeoutMs = lockTimeoutMs;
        this.clock = clock;
    }

    @Override
    public SnapshotLoadResult load() {
        String text;
        try {
            text = new String(Files.readAllBytes(snapshotFile), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return SnapshotLoadResult.fallback(Status.MISSING);
        } catch (IOException e) {
            log.warn("读取快照失败，按空缓存处理: file={}, error={}", snapshotFile, e.getMessage());
            return SnapshotLoadResult.fallback(Status.IO_ERROR);
        }

        CacheStore parsed;
        try {
            parsed = JSON.parseObject(text, CacheStore.class, Feature.OrderedField);
        } catch (RuntimeException e) {
            log.warn("快照已损坏，按空缓存处理: file={}, error={}", snapshotFile, e.getMessage());
            return SnapshotLoadResult.fallback(Status.CORRUPT);
        }
        if (parsed == null) {
            log.warn("快照内容为空，按空缓存处理: file={}", snapshotFile);
            return SnapshotLoadResult.fallback(Status.CORRUPT);
        }

        return prune(parsed);
    }

    /**
     * 回填指纹、剔除无效与过期条目
     */
    private SnapshotLoadResult prune(CacheStore parsed) {
        double now = clock.millis() / 1000.0;
        Map<String, CacheEntry> fresh = new LinkedHashMap<>();
        int pruned = 0;

        if (parsed.getEntries() != null) {
            for (Map.Entry<String, CacheEntry> e : parsed.getEntries().entrySet()) {
                CacheEntry entry = e.getValue();
                if (entry == null || !ttlPolicy.isValid(entry, now, ttlSeconds)) {
                    pruned++;
                    continue;
                }
                entry.setKey(e.getKey());
                fresh.put(e.getKey(), entry);
            }
        }

        CacheStats stats = parsed.getStats() != null ? parsed.getStats() : new CacheStats();
        if (pruned > 0) {
            log.debug("加载时清理过期条目: file={}, pruned={}", snapshotFile, pruned);
        }
        return SnapshotLoadResult.loaded(new CacheStore(fresh, stats), pruned);
    }

    @Override
    public boolean save(CacheStore store) {
        Path tempFile = null;
        try {
            Path parent = snapshotFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            byte[] content = JSON.toJSONString(store, SerializerFeature.PrettyFormat)
                    .getBytes(StandardCharsets.UTF_8);

            tempFile = Files.createTempFile(parent, snapshotFile.getFileName().toString(), ".tmp");
            Files.write(tempFile, content);
            moveIntoPlace(tempFile);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("写入快照失败，本次变更丢弃: file={}, error={}", snapshotFile, e.getMessage());
            deleteQuietly(tempFile);
            return false;
        }
    }

    private void moveIntoPlace(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, snapshotFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempFile, snapshotFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("删除临时文件失败: file={}, error={}", file, e.getMessage());
        }
    }

    @Override
    public SnapshotLock lock() {
        return FileSnapshotLock.acquire(lockFile, lockTimeoutMs);
    }
}
