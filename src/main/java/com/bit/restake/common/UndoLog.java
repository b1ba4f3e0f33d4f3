package com.bit.restake.common;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 单次调用内的撤销记录：失败时逆序执行，保证调用要么全部生效要么不生效
 */
public final class UndoLog {

    private final Deque<Runnable> actions = new ArrayDeque<>();

    public void push(Runnable undo) {
        actions.push(undo);
    }

    /**
     * 逆序回滚，撤销过程中的异常附加到原始异常上
     */
    public void rollback(RuntimeException cause) {
        while (!actions.isEmpty()) {
            Runnable undo = actions.pop();
            try {
                undo.run();
            } catch (RuntimeException e) {
                cause.addSuppressed(e);
            }
        }
    }
}
