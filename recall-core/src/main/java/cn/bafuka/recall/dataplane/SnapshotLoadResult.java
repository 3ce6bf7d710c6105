package cn.bafuka.recall.dataplane;

import cn.bafuka.recall.core.CacheStore;
import lombok.Getter;

/**
 * 快照加载结果
 * 无论成功与否都携带一个可用的 {@link CacheStore}，失败时为空快照
 */
@Getter
public final class SnapshotLoadResult {

    private final CacheStore store;

    private final Status status;

    /**
     * 加载时因过期被清理的条目数
     */
    private final int prunedCount;

    private SnapshotLoadResult(CacheStore store, Status status, int prunedCount) {
        this.store = store;
        this.status = status;
        this.prunedCount = prunedCount;
    }

    public static SnapshotLoadResult loaded(CacheStore store, int prunedCount) {
        return new SnapshotLoadResult(store, Status.LOADED, prunedCount);
    }

    public static SnapshotLoadResult fallback(Status status) {
        return new SnapshotLoadResult(CacheStore.empty(), status, 0);
    }

    public boolean isLoaded() {
        return status == Status.LOADED;
    }

    /**
     * 加载状态
     */
    public enum Status {
        /**
         * 正常读取
         */
        LOADED,

        /**
         * 快照文件不存在
         */
        MISSING,

        /**
         * JSON 损坏
         */
        CORRUPT,

        /**
         * 读取失败（权限、磁盘等）
         */
        IO_ERROR
    }
}
