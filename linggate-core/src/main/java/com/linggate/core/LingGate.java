package com.linggate.core;

import com.linggate.core.config.AuthorizerOptions;
import com.linggate.core.kernel.AuthorizationInterceptor;
import com.linggate.core.kernel.Authorizer;

import java.util.Map;

/**
 * 入口：一步得到鉴权拦截器
 */
public final class LingGate {

    private LingGate() {
    }

    public static AuthorizationInterceptor interceptor() {
        return new Authorizer().getInterceptor();
    }

    public static AuthorizationInterceptor interceptor(AuthorizerOptions options) {
        return new Authorizer(options).getInterceptor();
    }

    public static AuthorizationInterceptor interceptor(Map<String, ?> rules) {
        return new Authorizer(AuthorizerOptions.withRules(rules)).getInterceptor();
    }
}
