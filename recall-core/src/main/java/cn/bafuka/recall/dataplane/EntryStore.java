package cn.bafuka.recall.dataplane;

import cn.bafuka.recall.core.CacheStore;

/**
 * 条目存储接口
 * 负责快照的读取与写回，持久化失败从不向上抛出
 */
public interface EntryStore {

    /**
     * 读取快照，并清理已过期的条目
     * 文件缺失、JSON 损坏或 I/O 错误时返回空快照
     *
     * @return 加载结果
     */
    SnapshotLoadResult load();

    /**
     * 写回快照
     *
     * @param store 快照
     * @return 是否写入成功
     */
    boolean save(CacheStore store);

    /**
     * 获取读改写周期的协作锁
     *
     * @return 锁句柄
     */
    SnapshotLock lock();
}
