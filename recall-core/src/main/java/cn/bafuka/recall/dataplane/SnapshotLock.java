package cn.bafuka.recall.dataplane;

/**
 * 快照读改写周期上的协作锁
 * 获取失败时返回未持有锁的句柄，调用方照常继续
 */
public interface SnapshotLock extends AutoCloseable {

    /**
     * @return 是否实际持有锁
     */
    boolean isAcquired();

    /**
     * 释放锁，不抛出异常
     */
    @Override
    void close();
}
