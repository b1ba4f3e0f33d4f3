package com.bit.restake.aop.annotation;

import com.bit.restake.access.Role;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 管理权限注解：方法第一个 Address 参数视为调用方，执行前校验其角色
 * 需标注在实现类方法上
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequiresRole {

    Role value();
}
