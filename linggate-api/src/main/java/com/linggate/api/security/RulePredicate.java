package com.linggate.api.security;

import com.linggate.api.context.CallContext;

/**
 * 自定义规则（同步版本）
 * <p>
 * 抛出的任何异常都会被视为“不匹配”，不会中断调用。
 * </p>
 *
 * @author LingGate
 */
@FunctionalInterface
public interface RulePredicate {

    boolean test(CallContext context, Object token) throws Exception;
}
