package com.linggate.api.security;

import lombok.Getter;

/**
 * 单次鉴权的结果
 * <p>
 * 拒绝类结果携带 gRPC 状态码，调用方会根据数值分支，不可修改。
 * </p>
 *
 * @author LingGate
 */
@Getter
public enum AuthorizationOutcome {

    ALLOWED(0, "OK"),
    PERMISSION_DENIED(7, "Permission Denied"),
    UNAUTHENTICATED(16, "Unauthenticated");

    private final int code;
    private final String details;

    AuthorizationOutcome(int code, String details) {
        this.code = code;
        this.details = details;
    }

    public boolean isAllowed() {
        return this == ALLOWED;
    }

    /**
     * 三步协议的最后一步：由放行结果与认证结果组合出最终结论
     */
    public static AuthorizationOutcome of(boolean allowed, boolean authenticated) {
        if (allowed) return ALLOWED;
        return authenticated ? PERMISSION_DENIED : UNAUTHENTICATED;
    }
}
