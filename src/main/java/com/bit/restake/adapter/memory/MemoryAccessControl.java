package com.bit.restake.adapter.memory;

import com.bit.restake.access.AccessControl;
import com.bit.restake.access.Role;
import com.bit.restake.common.Address;
import com.bit.restake.config.RestakeConfig;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存角色表
 * 启动时：管理员获得全部管理角色，记账核心获得 BUFFER_FILLER，即时提现获得 INSTANT_WITHDRAWER
 */
@Slf4j
@Component
public class MemoryAccessControl implements AccessControl {

    private static final Set<Role> ADMIN_ROLES = EnumSet.of(
            Role.RESTAKE_MANAGER_ADMIN,
            Role.OPERATOR_DELEGATOR_ADMIN,
            Role.ORACLE_ADMIN,
            Role.WITHDRAW_QUEUE_ADMIN,
            Role.INSTANT_WITHDRAW_ADMIN,
            Role.DEPOSIT_WITHDRAW_PAUSER,
            Role.NATIVE_STAKE_ADMIN,
            Role.PRICE_RELAYER);

    private final RestakeConfig config;
    private final Map<Address, Set<Role>> grants = new ConcurrentHashMap<>();

    public MemoryAccessControl(RestakeConfig config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        for (Role role : ADMIN_ROLES) {
            grant(config.adminAddress(), role);
        }
        grant(config.accountingAddress(), Role.BUFFER_FILLER);
        grant(config.instantWithdrawerAddress(), Role.INSTANT_WITHDRAWER);
        log.info("角色初始化完成 admin={}", config.adminAddress());
    }

    @Override
    public boolean hasRole(Address account, Role role) {
        return grants.getOrDefault(account, Set.of()).contains(role);
    }

    public void grant(Address account, Role role) {
        grants.computeIfAbsent(account, a -> ConcurrentHashMap.newKeySet()).add(role);
    }

    public void revoke(Address account, Role role) {
        Set<Role> roles = grants.get(account);
        if (roles != null) {
            roles.remove(role);
        }
    }
}
