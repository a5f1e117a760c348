package com.linggate.sample.security;

import java.util.Set;

/**
 * 演示用调用凭证：主体 + 已授予的角色
 */
public record CallerToken(String subject, Set<String> roles) {

    public CallerToken {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }
}
