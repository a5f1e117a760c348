package com.linggate.core.audit;

import com.linggate.api.context.CallContext;
import com.linggate.api.security.AuthorizationOutcome;
import com.linggate.core.rule.AccessRule;
import lombok.extern.slf4j.Slf4j;

/**
 * 默认观察者：写 SLF4J 日志
 */
@Slf4j
public class Slf4jAuthorizationListener implements AuthorizationListener {

    @Override
    public void onPredicateError(CallContext context, AccessRule rule, Throwable error) {
        log.error("Error in custom rule, denying access. Method=[{}], Rule=[{}]",
                context.getMethodFullName(), rule, error);
    }

    @Override
    public void onDecision(CallContext context, AuthorizationOutcome outcome) {
        if (!outcome.isAllowed()) {
            log.warn("DENY: [{}] {} (code={})", context.getMethodFullName(), outcome.getDetails(), outcome.getCode());
        } else {
            log.debug("ALLOW: [{}]", context.getMethodFullName());
        }
    }
}
