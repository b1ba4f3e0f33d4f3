package com.bit.restake.common;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 账本全局锁：所有写入口串行执行，形成调用的全序
 * 可重入，便于组件之间的嵌套调用
 */
@Component
public class LedgerLock {

    private final ReentrantLock lock = new ReentrantLock(true);

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
