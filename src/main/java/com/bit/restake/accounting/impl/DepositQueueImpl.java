package com.bit.restake.accounting.impl;

import com.bit.restake.access.Role;
import com.bit.restake.accounting.DepositQueue;
import com.bit.restake.aop.annotation.RequiresRole;
import com.bit.restake.common.Address;
import com.bit.restake.common.LedgerLock;
import com.bit.restake.common.ReentrancyGuard;
import com.bit.restake.config.RestakeConfig;
import com.bit.restake.event.EventRecorder;
import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;
import com.bit.restake.registry.DelegateRegistry;
import com.bit.restake.structure.delegate.OperatorDelegate;
import com.bit.restake.structure.event.EventType;
import com.bit.restake.structure.event.RestakeEvent;
import com.bit.restake.token.AssetLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

import static com.bit.restake.common.RestakeConstants.VALIDATOR_DEPOSIT;
import static com.bit.restake.util.Validations.requirePositive;

@Slf4j
@Service
public class DepositQueueImpl implements DepositQueue {

    private final Address self;
    private final AssetLedger assetLedger;
    private final DelegateRegistry delegateRegistry;
    private final EventRecorder eventRecorder;
    private final ReentrancyGuard guard;

    private BigInteger staged = BigInteger.ZERO;

    public DepositQueueImpl(RestakeConfig config, AssetLedger assetLedger, DelegateRegistry delegateRegistry,
                            EventRecorder eventRecorder, LedgerLock ledgerLock) {
        this.self = config.depositQueueAddress();
        this.assetLedger = assetLedger;
        this.delegateRegistry = delegateRegistry;
        this.eventRecorder = eventRecorder;
        this.guard = new ReentrancyGuard("DepositQueue", ledgerLock);
    }

    @Override
    public Address getAddress() {
        return self;
    }

    @Override
    public BigInteger stagedBalance() {
        return guard.read(() -> staged);
    }

    @Override
    public void stage(Address from, BigInteger amount) {
        requirePositive(amount, "amount");
        guard.run(() -> {
            assetLedger.transfer(Address.NATIVE, from, self, amount);
            staged = staged.add(amount);
            log.debug("staged native {} from {}, total staged {}", amount, from, staged);
        });
    }

    @Override
    @RequiresRole(Role.NATIVE_STAKE_ADMIN)
    public BigInteger stakeStagedNative(Address caller, Address delegate, int validatorCount) {
        if (validatorCount <= 0) {
            throw new RestakeException(ErrorType.INVALID_ZERO_INPUT, "validatorCount=" + validatorCount);
        }
        return guard.call(() -> {
            OperatorDelegate target = delegateRegistry.get(delegate);
            BigInteger amount = VALIDATOR_DEPOSIT.multiply(BigInteger.valueOf(validatorCount));
            if (amount.compareTo(staged) > 0) {
                throw new RestakeException(ErrorType.INSUFFICIENT_STAGED_BALANCE,
                        "需要 " + amount + " 暂存 " + staged);
            }
            // 先扣暂存再转出
            staged = staged.subtract(amount);
            try {
                assetLedger.transfer(Address.NATIVE, self, target.getPool().getAddress(), amount);
                target.getPool().deposit(Address.NATIVE, amount);
            } catch (RuntimeException e) {
                staged = staged.add(amount);
                throw e;
            }
            eventRecorder.record(RestakeEvent.builder()
                    .type(EventType.NATIVE_STAKED)
                    .account(delegate)
                    .asset(Address.NATIVE)
                    .amount(amount)
                    .detail("validators=" + validatorCount)
                    .build());
            return amount;
        });
    }
}
