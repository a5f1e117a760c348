package com.linggate.api.invoke;

import java.util.concurrent.CompletionStage;

/**
 * 下游处理器：鉴权通过后才会被调用
 *
 * @param <T> 调用结果类型
 * @author LingGate
 */
@FunctionalInterface
public interface CallHandler<T> {

    CompletionStage<T> proceed() throws Exception;
}
