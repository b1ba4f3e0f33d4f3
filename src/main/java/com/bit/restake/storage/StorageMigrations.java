package com.bit.restake.storage;

import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;
import com.bit.restake.structure.buffer.BufferState;
import com.bit.restake.structure.withdraw.WithdrawRequest;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.List;

/**
 * 存储版本升级，每一步只补充新字段的默认值
 */
@Slf4j
public final class StorageMigrations {

    private StorageMigrations() {
    }

    public static WithdrawQueueStorage migrate(WithdrawQueueStorage storage) {
        int version = storage.getSchemaVersion();
        if (version < 1 || version > WithdrawQueueStorage.CURRENT_VERSION) {
            throw new RestakeException(ErrorType.UNSUPPORTED_SCHEMA_VERSION, "version=" + version);
        }
        if (version < 2) {
            toV2(storage);
        }
        if (version < 3) {
            toV3(storage);
        }
        if (version != storage.getSchemaVersion()) {
            log.info("withdraw queue storage migrated v{} -> v{}", version, storage.getSchemaVersion());
        }
        return storage;
    }

    // v2：引入排队，旧缓冲计数器从0开始，旧请求都视为已全额预留
    private static void toV2(WithdrawQueueStorage storage) {
        for (BufferState buffer : storage.getBuffers().values()) {
            if (buffer.getQueueToFill() == null) {
                buffer.setQueueToFill(BigInteger.ZERO);
            }
            if (buffer.getQueueFilled() == null) {
                buffer.setQueueFilled(BigInteger.ZERO);
            }
        }
        for (List<WithdrawRequest> requests : storage.getRequests().values()) {
            for (WithdrawRequest request : requests) {
                request.setQueued(false);
                if (request.getFillAt() == null) {
                    request.setFillAt(BigInteger.ZERO);
                }
            }
        }
        storage.setSchemaVersion(2);
    }

    private static void toV3(WithdrawQueueStorage storage) {
        for (List<WithdrawRequest> requests : storage.getRequests().values()) {
            for (WithdrawRequest request : requests) {
                request.setInstant(false);
            }
        }
        storage.setSchemaVersion(3);
    }
}
