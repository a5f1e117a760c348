package com.linggate.api.exception;

/**
 * 规则加载失败（配置错误）
 * 在构建期抛出，网关不可用。
 *
 * @author LingGate
 */
public class RulesLoadException extends LingGateException {

    public RulesLoadException(String message) {
        super(message);
    }

    public RulesLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
