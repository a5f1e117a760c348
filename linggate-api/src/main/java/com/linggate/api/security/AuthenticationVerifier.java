package com.linggate.api.security;

import com.linggate.api.context.CallContext;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 宿主提供 - 认证判定
 *
 * @author LingGate
 */
@FunctionalInterface
public interface AuthenticationVerifier {

    CompletionStage<Boolean> isAuthenticated(CallContext context);

    /**
     * 默认实现：调用携带非空 token 即视为已认证
     */
    static AuthenticationVerifier tokenPresent() {
        return context -> CompletableFuture.completedFuture(context.hasToken());
    }
}
