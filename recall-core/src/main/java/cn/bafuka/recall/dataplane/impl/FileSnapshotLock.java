package cn.bafuka.recall.dataplane.impl;

import cn.bafuka.recall.dataplane.SnapshotLock;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 基于 {@link FileLock} 的跨进程协作锁
 * 锁文件与快照同目录（{@code <snapshot>.lock}），有限次退避重试后放弃，不会无限阻塞
 */
@Slf4j
public final class FileSnapshotLock implements SnapshotLock {

    private static final long INITIAL_RETRY_DELAY_MS = 100;
    private static final long MAX_RETRY_DELAY_MS = 500;

    private final FileChannel channel;

    private final FileLock fileLock;

    private FileSnapshotLock(FileChannel channel, FileLock fileLock) {
        this.channel = channel;
        this.fileLock = fileLock;
    }

    /**
     * 尝试获取锁
     *
     * @param lockFile  锁文件
     * @param timeoutMs 最长等待时间（毫秒）
     * @return 锁句柄，获取失败时为未持有状态
     */
    public static FileSnapshotLock acquire(Path lockFile, long timeoutMs) {
        FileChannel channel = null;
        try {
            Path parent = lockFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);

            long deadline = System.currentTimeMillis() + timeoutMs;
            long retryDelayMs = INITIAL_RETRY_DELAY_MS;
            while (true) {
                FileLock lock = tryLock(channel);
                if (lock != null) {
                    return new FileSnapshotLock(channel, lock);
                }

                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    log.warn("获取快照锁超时，继续执行: lockFile={}, timeoutMs={}", lockFile, timeoutMs);
                    closeQuietly(channel);
                    return unlocked();
                }

                Thread.sleep(Math.min(retryDelayMs, remaining));
                // 指数退避，但最大不超过 500ms
                retryDelayMs = Math.min(retryDelayMs * 2, MAX_RETRY_DELAY_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeQuietly(channel);
            return unlocked();
        } catch (IOException e) {
            log.warn("无法打开快照锁文件，继续执行: lockFile={}, error={}", lockFile, e.getMessage());
            closeQuietly(channel);
            return unlocked();
        }
    }

    /**
     * 未持有锁的句柄
     */
    public static FileSnapshotLock unlocked() {
        return new FileSnapshotLock(null, null);
    }

    private static FileLock tryLock(FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException e) {
            // 同一 JVM 内已持有
            return null;
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("关闭锁文件失败: {}", e.getMessage());
        }
    }

    @Override
    public boolean isAcquired() {
        return fileLock != null && fileLock.isValid();
    }

    @Override
    public void close() {
        if (fileLock != null) {
            try {
                fileLock.release();
            } catch (IOException e) {
                log.debug("释放快照锁失败: {}", e.getMessage());
            }
        }
        closeQuietly(channel);
    }
}
