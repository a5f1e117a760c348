package com.linggate.sample.security;

import com.linggate.api.security.PermissionResolver;
import com.linggate.api.security.RulePredicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Configuration
public class GreeterSecurityConfiguration {

    public static final String TENANT_KEY = "x-tenant";

    // 角色直接取自凭证
    @Bean
    public PermissionResolver callerRoleResolver() {
        return context -> {
            if (context.getToken() instanceof CallerToken token) {
                return CompletableFuture.completedFuture(token.roles());
            }
            return CompletableFuture.completedFuture(Set.of());
        };
    }

    /**
     * 规则文件中以 !predicate customValidation 引用
     * <p>
     * 仅放行声明了 acme 租户的已登录调用方
     */
    @Bean
    public RulePredicate customValidation() {
        return (context, token) -> {
            Object tenant = context.getMetadata().get(TENANT_KEY);
            log.debug("customValidation: method={}, tenant={}", context.getMethodFullName(), tenant);
            return token instanceof CallerToken && "acme".equals(tenant);
        };
    }
}
