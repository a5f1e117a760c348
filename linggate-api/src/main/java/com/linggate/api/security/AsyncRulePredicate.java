package com.linggate.api.security;

import com.linggate.api.context.CallContext;

import java.util.concurrent.CompletionStage;

/**
 * 自定义规则（异步版本），适用于需要访问外部系统的判定
 * <p>
 * 同步抛出异常或异常完成的 Stage 都会被视为“不匹配”。
 * </p>
 *
 * @author LingGate
 */
@FunctionalInterface
public interface AsyncRulePredicate {

    CompletionStage<Boolean> test(CallContext context, Object token) throws Exception;
}
