package com.linggate.api.security;

import com.linggate.api.context.CallContext;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 宿主提供 - 角色查询
 * 负责解析调用方拥有的角色集合，可以是异步的（例如查询外部身份服务）。
 *
 * @author LingGate
 */
@FunctionalInterface
public interface PermissionResolver {

    /**
     * 解析调用方角色
     *
     * @param context 调用上下文
     * @return 角色集合，不允许为 null
     */
    CompletionStage<Set<String>> resolve(CallContext context);

    /**
     * 默认实现：没有任何角色
     */
    static PermissionResolver none() {
        return context -> CompletableFuture.completedFuture(Collections.emptySet());
    }
}
