package com.bit.restake.exception;

/**
 * 错误大类：决定调用方能否重试
 */
public enum ErrorCategory {
    /** 输入错误：修正参数前不可重试 */
    INPUT,
    /** 状态错误：已存在/不存在/一次性值已设置等 */
    STATE,
    /** 经济保护：上限、价格、缓冲不足等，条件变化后可重试 */
    ECONOMIC_GUARD,
    /** 权限不足 */
    AUTHORIZATION
}
