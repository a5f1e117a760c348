package com.linggate.api.exception;

import com.linggate.api.security.AuthorizationOutcome;

/**
 * 权限拒绝异常
 * 调用方已认证，但规则表中没有任何规则放行此次调用。code = 7
 *
 * @author LingGate
 */
public class PermissionDeniedException extends AuthorizationException {

    public PermissionDeniedException(String methodFullName) {
        super(AuthorizationOutcome.PERMISSION_DENIED, methodFullName);
    }
}
