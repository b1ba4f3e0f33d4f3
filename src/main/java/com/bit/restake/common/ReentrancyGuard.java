package com.bit.restake.common;

import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;

import java.util.function.Supplier;

/**
 * 组件级防重入：同一组件在外部划转进行中不能再次进入
 * entered 只在持有账本锁时读写
 */
public final class ReentrancyGuard {

    private final String component;
    private final LedgerLock ledgerLock;
    private boolean entered;

    public ReentrancyGuard(String component, LedgerLock ledgerLock) {
        this.component = component;
        this.ledgerLock = ledgerLock;
    }

    public <T> T call(Supplier<T> body) {
        ledgerLock.lock();
        try {
            if (entered) {
                throw new RestakeException(ErrorType.REENTRANT_CALL, component);
            }
            entered = true;
            try {
                return body.get();
            } finally {
                entered = false;
            }
        } finally {
            ledgerLock.unlock();
        }
    }

    public void run(Runnable body) {
        call(() -> {
            body.run();
            return null;
        });
    }

    /**
     * 只读视图也在账本锁内读取，避免读到写入一半的状态
     */
    public <T> T read(Supplier<T> body) {
        ledgerLock.lock();
        try {
            return body.get();
        } finally {
            ledgerLock.unlock();
        }
    }
}
