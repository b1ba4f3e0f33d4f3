package com.bit.restake.storage;

import com.bit.restake.common.Address;
import com.bit.restake.structure.buffer.BufferState;
import com.bit.restake.structure.withdraw.WithdrawRequest;
import lombok.Data;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 提现队列的长期账本存储，字段只做增量扩展
 * v1: 缓冲 + 请求
 * v2: 排队计数器、请求的 queued / fillAt
 * v3: 请求的 instant 标记
 * 旧版本数据通过 {@link StorageMigrations#migrate} 升级
 */
@Data
@Component
public class WithdrawQueueStorage {

    public static final int CURRENT_VERSION = 3;

    private int schemaVersion = CURRENT_VERSION;

    // 资产 -> 缓冲
    private Map<Address, BufferState> buffers = new LinkedHashMap<>();

    // 用户 -> 未领取请求（领取时交换删除，顺序不保证）
    private Map<Address, List<WithdrawRequest>> requests = new LinkedHashMap<>();

    private long nextRequestId = 1;

    // 本地冷却期（秒），小于0表示尚未从配置初始化
    private long cooldownSeconds = -1;

    private boolean paused;

    public BufferState buffer(Address asset) {
        return buffers.computeIfAbsent(asset, a -> new BufferState());
    }

    public List<WithdrawRequest> requestsOf(Address user) {
        return requests.computeIfAbsent(user, u -> new ArrayList<>());
    }
}
