package com.linggate.api.exception;

import com.linggate.api.security.AuthorizationOutcome;
import lombok.Getter;

/**
 * 鉴权拒绝异常
 * 携带与 gRPC 状态一致的 code / details，传输层可以直接映射为响应状态。
 *
 * @author LingGate
 */
@Getter
public abstract class AuthorizationException extends LingGateException {

    private final AuthorizationOutcome outcome;
    private final String methodFullName;

    protected AuthorizationException(AuthorizationOutcome outcome, String methodFullName) {
        super(outcome.getDetails() + ": " + methodFullName);
        this.outcome = outcome;
        this.methodFullName = methodFullName;
    }

    public int getCode() {
        return outcome.getCode();
    }

    public String getDetails() {
        return outcome.getDetails();
    }

    public static AuthorizationException of(AuthorizationOutcome outcome, String methodFullName) {
        return switch (outcome) {
            case PERMISSION_DENIED -> new PermissionDeniedException(methodFullName);
            case UNAUTHENTICATED -> new UnauthenticatedException(methodFullName);
            case ALLOWED -> throw new IllegalArgumentException("ALLOWED is not a denial");
        };
    }
}
