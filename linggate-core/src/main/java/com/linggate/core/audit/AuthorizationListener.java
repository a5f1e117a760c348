package com.linggate.core.audit;

import com.linggate.api.context.CallContext;
import com.linggate.api.security.AuthorizationOutcome;
import com.linggate.core.rule.AccessRule;

/**
 * 鉴权观察者
 * <p>
 * 自定义判定的异常在这里上报后被吞掉（视为不匹配），不会传播给调用方。
 * 回调在鉴权链路上同步执行，实现方不应阻塞。
 * </p>
 */
public interface AuthorizationListener {

    /**
     * 自定义判定执行失败，每次失败恰好回调一次
     */
    void onPredicateError(CallContext context, AccessRule rule, Throwable error);

    /**
     * 一次调用得出结论
     */
    default void onDecision(CallContext context, AuthorizationOutcome outcome) {
    }
}
