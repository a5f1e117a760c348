package com.linggate.core.security;

import com.linggate.api.context.CallContext;
import com.linggate.api.security.AuthenticationVerifier;
import com.linggate.core.audit.AuthorizationListener;
import com.linggate.core.rule.AccessRule;
import com.linggate.core.rule.RuleList;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * 规则匹配器
 * <p>
 * 单条规则的匹配以及规则列表的“任意一条匹配”判定。列表按顺序求值，命中即停止，
 * 命中之后的自定义判定不会被调用。
 * </p>
 */
public class RuleMatcher {

    private static final CompletionStage<Boolean> TRUE = CompletableFuture.completedStage(true);
    private static final CompletionStage<Boolean> FALSE = CompletableFuture.completedStage(false);

    private final AuthenticationVerifier authenticationVerifier;
    private final AuthorizationListener listener;

    public RuleMatcher(AuthenticationVerifier authenticationVerifier, AuthorizationListener listener) {
        this.authenticationVerifier = authenticationVerifier;
        this.listener = listener;
    }

    public CompletionStage<Boolean> anyMatch(RuleList rules, Set<String> roles, CallContext context) {
        return anyMatch(rules, 0, roles, context);
    }

    private CompletionStage<Boolean> anyMatch(RuleList rules, int index, Set<String> roles, CallContext context) {
        if (index >= rules.size()) {
            return FALSE;
        }
        return matches(rules.get(index), roles, context)
                .thenCompose(matched -> matched ? TRUE : anyMatch(rules, index + 1, roles, context));
    }

    public CompletionStage<Boolean> matches(AccessRule rule, Set<String> roles, CallContext context) {
        if (rule instanceof AccessRule.Anonymous) {
            return TRUE;
        }
        if (rule instanceof AccessRule.Authenticated) {
            // 认证判定的异常不属于判定异常，照常传播
            return authenticationVerifier.isAuthenticated(context).thenApply(Boolean.TRUE::equals);
        }
        if (rule instanceof AccessRule.RoleName role) {
            return roles.contains(role.name()) ? TRUE : FALSE;
        }
        if (rule instanceof AccessRule.Predicate predicate) {
            try {
                return predicate.function().test(context, context.getToken()) ? TRUE : FALSE;
            } catch (Throwable e) {
                return predicateFailed(rule, context, e);
            }
        }
        if (rule instanceof AccessRule.AsyncPredicate predicate) {
            CompletionStage<Boolean> stage;
            try {
                stage = predicate.function().test(context, context.getToken());
            } catch (Throwable e) {
                return predicateFailed(rule, context, e);
            }
            if (stage == null) {
                return FALSE;
            }
            return stage.handle((result, error) -> {
                if (error != null) {
                    listener.onPredicateError(context, rule, unwrap(error));
                    return false;
                }
                return Boolean.TRUE.equals(result);
            });
        }
        // Malformed
        return FALSE;
    }

    private CompletionStage<Boolean> predicateFailed(AccessRule rule, CallContext context, Throwable error) {
        listener.onPredicateError(context, rule, error);
        return FALSE;
    }

    static Throwable unwrap(Throwable error) {
        if ((error instanceof CompletionException || error instanceof ExecutionException) && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
