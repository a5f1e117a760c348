package com.linggate.api.exception;

import com.linggate.api.security.AuthorizationOutcome;

/**
 * 未认证异常
 * 调用方未认证且未被放行。code = 16
 *
 * @author LingGate
 */
public class UnauthenticatedException extends AuthorizationException {

    public UnauthenticatedException(String methodFullName) {
        super(AuthorizationOutcome.UNAUTHENTICATED, methodFullName);
    }
}
