package com.bit.restake.structure.event;

public enum EventType {
    DEPOSIT,
    NATIVE_DEPOSIT,
    NATIVE_STAKED,
    WITHDRAW_REQUESTED,
    WITHDRAW_QUEUED,
    QUEUE_FILLED,
    BUFFER_FILLED,
    BUFFER_FILL_REVERTED,
    CLAIMED,
    INSTANT_WITHDRAW,
    REFILL_INITIATED,
    REFILL_COMPLETED,
    CONFIG_CHANGED
}
