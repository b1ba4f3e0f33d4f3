package com.bit.restake.aop;

import com.bit.restake.access.AccessControl;
import com.bit.restake.aop.annotation.RequiresRole;
import com.bit.restake.common.Address;
import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

@Slf4j
@Aspect
@Component
public class RoleAspect {

    private final AccessControl accessControl;

    public RoleAspect(AccessControl accessControl) {
        this.accessControl = accessControl;
    }

    /**
     * 设置切入点 在注解的位置切入代码
     */
    @Pointcut("@annotation(com.bit.restake.aop.annotation.RequiresRole)")
    public void rolePointCut() {}

    @Around(value = "rolePointCut() && @annotation(requiresRole)")
    public Object around(ProceedingJoinPoint pjp, RequiresRole requiresRole) throws Throwable {
        MethodSignature signature = (MethodSignature) pjp.getSignature();
        Method method = signature.getMethod();
        Address caller = findCaller(pjp.getArgs());
        if (caller == null) {
            throw new IllegalStateException("@RequiresRole 方法缺少调用方参数: " + method.getName());
        }
        if (!accessControl.hasRole(caller, requiresRole.value())) {
            log.warn("拒绝调用 {}: caller={} 缺少角色 {}", method.getName(), caller, requiresRole.value());
            throw new RestakeException(ErrorType.NOT_AUTHORIZED,
                    caller + " 缺少角色 " + requiresRole.value());
        }
        return pjp.proceed();
    }

    private Address findCaller(Object[] args) {
        for (Object arg : args) {
            if (arg instanceof Address) {
                return (Address) arg;
            }
        }
        return null;
    }
}
