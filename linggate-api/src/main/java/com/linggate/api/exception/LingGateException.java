package com.linggate.api.exception;

/**
 * LingGate 基础异常
 *
 * @author LingGate
 */
public class LingGateException extends RuntimeException {

    public LingGateException(String message) {
        super(message);
    }

    public LingGateException(String message, Throwable cause) {
        super(message, cause);
    }
}
