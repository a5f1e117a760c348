package com.linggate.core.kernel;

import com.linggate.api.context.CallContext;
import com.linggate.api.security.AccessDecider;
import com.linggate.api.security.AuthenticationVerifier;
import com.linggate.api.security.AuthorizationOutcome;
import com.linggate.api.security.PermissionResolver;
import com.linggate.core.audit.AuthorizationListener;
import com.linggate.core.config.AuthorizerOptions;
import com.linggate.core.loader.RulesFileLoader;
import com.linggate.core.rule.RuleTable;
import com.linggate.core.rule.RuleTableBuilder;
import com.linggate.core.security.RuleMatcher;
import com.linggate.core.security.RuleTableAccessDecider;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * 鉴权器
 * <p>
 * 构建期：加载并归一化规则表（只构建一次，之后只读）。
 * 调用期：三步协议
 * 1. 解析调用方角色
 * 2. 并发执行放行判定与认证判定
 * 3. 组合出结论：放行 / 权限拒绝 / 未认证
 * </p>
 * 协作者抛出的异常（自定义规则判定除外）原样传播给调用方。
 */
@Slf4j
public class Authorizer {

    @Getter
    private final RuleTable rules;
    private final PermissionResolver permissionResolver;
    private final AuthenticationVerifier authenticationVerifier;
    private final AccessDecider accessDecider;
    private final AuthorizationListener listener;

    @Getter
    private final AuthorizationInterceptor interceptor;

    public Authorizer() {
        this(AuthorizerOptions.defaults());
    }

    public Authorizer(AuthorizerOptions options) {
        this.permissionResolver = options.getPermissionResolver();
        this.authenticationVerifier = options.getAuthenticationVerifier();
        this.listener = options.getListener();
        this.rules = new RuleTableBuilder(options.getPredicates()).build(loadRules(options));

        if (options.getAccessDecider() != null) {
            log.info("[LingGate] Custom AccessDecider [{}] installed, rule table is bypassed",
                    options.getAccessDecider().getClass().getName());
            this.accessDecider = options.getAccessDecider();
        } else {
            this.accessDecider = new RuleTableAccessDecider(rules, new RuleMatcher(authenticationVerifier, listener));
        }
        this.interceptor = new AuthorizationInterceptor(this);
    }

    private static Map<String, ?> loadRules(AuthorizerOptions options) {
        if (options.getRules() != null) {
            return options.getRules();
        }
        return RulesFileLoader.load(options.getRulesFile());
    }

    /**
     * 执行一次完整的鉴权协议
     */
    public CompletionStage<AuthorizationOutcome> authorize(CallContext context) {
        return getPermissions(context).thenCompose(roles -> {
            Set<String> resolved = roles != null ? roles : Collections.emptySet();
            // 放行判定与认证判定互不依赖，同时发起
            CompletableFuture<Boolean> allowed = isAllowed(context, resolved).toCompletableFuture();
            CompletableFuture<Boolean> authenticated = isAuthenticated(context).toCompletableFuture();
            return allowed.thenCombine(authenticated,
                    (a, b) -> AuthorizationOutcome.of(Boolean.TRUE.equals(a), Boolean.TRUE.equals(b)));
        }).thenApply(outcome -> {
            listener.onDecision(context, outcome);
            return outcome;
        });
    }

    public CompletionStage<Set<String>> getPermissions(CallContext context) {
        return call(() -> permissionResolver.resolve(context));
    }

    public CompletionStage<Boolean> isAllowed(CallContext context, Set<String> roles) {
        return call(() -> accessDecider.isAllowed(context, roles));
    }

    public CompletionStage<Boolean> isAuthenticated(CallContext context) {
        return call(() -> authenticationVerifier.isAuthenticated(context));
    }

    // 同步抛出的异常统一转为失败的 Stage
    private static <T> CompletionStage<T> call(Supplier<CompletionStage<T>> supplier) {
        try {
            CompletionStage<T> stage = supplier.get();
            if (stage == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("Collaborator returned no result"));
            }
            return stage;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
