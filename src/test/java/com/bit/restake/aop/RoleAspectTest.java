package com.bit.restake.aop;

import com.bit.restake.access.Role;
import com.bit.restake.adapter.memory.MemoryAccessControl;
import com.bit.restake.aop.annotation.RequiresRole;
import com.bit.restake.common.Address;
import com.bit.restake.config.RestakeConfig;
import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import static org.junit.jupiter.api.Assertions.*;

public class RoleAspectTest {

    private static final Address OWNER = Address.ofIndex(0x77);
    private static final Address STRANGER = Address.ofIndex(0x78);

    private MemoryAccessControl accessControl;
    private Guarded guarded;

    public static class Guarded {
        private int calls;

        @RequiresRole(Role.ORACLE_ADMIN)
        public int touch(Address caller) {
            return ++calls;
        }

        // 调用方不必是第一个参数
        @RequiresRole(Role.ORACLE_ADMIN)
        public int touchWith(long amount, Address caller, Address other) {
            calls += (int) amount;
            return calls;
        }

        @RequiresRole(Role.ORACLE_ADMIN)
        public int missingCaller(long amount) {
            return calls;
        }

        public int open() {
            return calls;
        }
    }

    @BeforeEach
    void setUp() {
        accessControl = new MemoryAccessControl(new RestakeConfig());
        accessControl.grant(OWNER, Role.ORACLE_ADMIN);
        AspectJProxyFactory factory = new AspectJProxyFactory(new Guarded());
        factory.setProxyTargetClass(true);
        factory.addAspect(new RoleAspect(accessControl));
        guarded = factory.getProxy();
    }

    @Test
    void grantedCallerPasses() {
        assertEquals(1, guarded.touch(OWNER));
        assertEquals(4, guarded.touchWith(3, OWNER, STRANGER));
    }

    @Test
    void missingRoleRejected() {
        RestakeException e = assertThrows(RestakeException.class, () -> guarded.touch(STRANGER));
        assertEquals(ErrorType.NOT_AUTHORIZED, e.getErrorType());
        // 第一个 Address 参数才是调用方
        assertThrows(RestakeException.class, () -> guarded.touchWith(1, STRANGER, OWNER));
        assertEquals(0, guarded.open());
    }

    @Test
    void revokeTakesEffectImmediately() {
        guarded.touch(OWNER);
        accessControl.revoke(OWNER, Role.ORACLE_ADMIN);
        assertThrows(RestakeException.class, () -> guarded.touch(OWNER));
    }

    @Test
    void annotatedMethodWithoutCallerIsMisconfigured() {
        assertThrows(IllegalStateException.class, () -> guarded.missingCaller(1));
    }

    @Test
    void nullCallerRejected() {
        // null 不是 Address 实例，视为缺少调用方
        assertThrows(IllegalStateException.class, () -> guarded.touch(null));
    }
}
