package com.linggate.api.security;

import com.linggate.api.context.CallContext;

import java.util.Set;
import java.util.concurrent.CompletionStage;

/**
 * 放行判定
 * <p>
 * 默认由核心层的规则表实现；宿主可以整体替换，此时规则表不再参与判定。
 * </p>
 *
 * @author LingGate
 */
@FunctionalInterface
public interface AccessDecider {

    /**
     * @param context 调用上下文
     * @param roles   已解析的调用方角色
     * @return 是否放行
     */
    CompletionStage<Boolean> isAllowed(CallContext context, Set<String> roles);
}
