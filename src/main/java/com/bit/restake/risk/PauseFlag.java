package com.bit.restake.risk;

public enum PauseFlag {
    DEPOSIT,
    WITHDRAW,
    CLAIM,
    INSTANT_WITHDRAW
}
