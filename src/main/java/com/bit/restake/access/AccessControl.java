package com.bit.restake.access;

import com.bit.restake.common.Address;

/**
 * 角色权限（外部协作方），每个管理操作执行前校验
 */
public interface AccessControl {

    boolean hasRole(Address caller, Role role);
}
