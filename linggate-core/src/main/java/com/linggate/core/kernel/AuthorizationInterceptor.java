package com.linggate.core.kernel;

import com.linggate.api.context.CallContext;
import com.linggate.api.exception.AuthorizationException;
import com.linggate.api.invoke.CallHandler;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * 鉴权拦截器：交给宿主的唯一产物，形如 (context, next) -> Future
 * <p>
 * 放行时恰好调用一次 next 并返回其结果；拒绝时不调用 next，
 * 以 {@link AuthorizationException}（code 7 / 16）异常完成。
 * </p>
 * 调用方取消返回的 Future 后，next 不会再被调用；已在执行中的判定不会被中断。
 */
public class AuthorizationInterceptor {

    private final Authorizer authorizer;

    AuthorizationInterceptor(Authorizer authorizer) {
        this.authorizer = authorizer;
    }

    public <T> CompletableFuture<T> intercept(CallContext context, CallHandler<T> next) {
        CompletableFuture<T> result = new CompletableFuture<>();
        authorizer.authorize(context).whenComplete((outcome, error) -> {
            if (result.isDone()) {
                return;
            }
            if (error != null) {
                result.completeExceptionally(unwrap(error));
                return;
            }
            if (!outcome.isAllowed()) {
                result.completeExceptionally(AuthorizationException.of(outcome, context.getMethodFullName()));
                return;
            }
            proceed(next, result);
        });
        return result;
    }

    private static <T> void proceed(CallHandler<T> next, CompletableFuture<T> result) {
        CompletionStage<T> stage;
        try {
            stage = next.proceed();
        } catch (Throwable e) {
            result.completeExceptionally(e);
            return;
        }
        if (stage == null) {
            result.completeExceptionally(new IllegalStateException("CallHandler returned no result"));
            return;
        }
        stage.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete(value);
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        if ((error instanceof CompletionException || error instanceof ExecutionException) && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
