package com.linggate.core.config;

import com.linggate.api.security.AccessDecider;
import com.linggate.api.security.AuthenticationVerifier;
import com.linggate.api.security.PermissionResolver;
import com.linggate.api.security.RulePredicate;
import com.linggate.core.audit.AuthorizationListener;
import com.linggate.core.audit.Slf4jAuthorizationListener;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;

/**
 * 鉴权器构建参数 (Immutable)
 * <p>
 * 所有可替换的协作者都在这里显式注入，并带有默认实现：
 * 1. 规则来源：内联 rules 优先，否则读取 rulesFile
 * 2. 角色解析 / 认证判定 / 放行判定
 * 3. 鉴权观察者
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class AuthorizerOptions {

    public static final String DEFAULT_RULES_FILE = "access-rules.yml";

    /**
     * 内联规则：服务名 -> (规则 | 规则列表 | 方法名 -> 规则或规则列表)
     * <p>
     * 非空时不再读取规则文件
     */
    private final Map<String, ?> rules;

    /**
     * 规则文件路径，相对路径基于工作目录；支持 classpath: 前缀
     */
    @Builder.Default
    private final String rulesFile = DEFAULT_RULES_FILE;

    /**
     * 具名判定，供规则文件中的 !predicate 引用
     */
    @Builder.Default
    private final Map<String, RulePredicate> predicates = Collections.emptyMap();

    @Builder.Default
    private final PermissionResolver permissionResolver = PermissionResolver.none();

    @Builder.Default
    private final AuthenticationVerifier authenticationVerifier = AuthenticationVerifier.tokenPresent();

    /**
     * 为 null 时使用规则表判定
     */
    private final AccessDecider accessDecider;

    @Builder.Default
    private final AuthorizationListener listener = new Slf4jAuthorizationListener();

    public static AuthorizerOptions defaults() {
        return AuthorizerOptions.builder().build();
    }

    public static AuthorizerOptions withRules(Map<String, ?> rules) {
        return AuthorizerOptions.builder().rules(rules).build();
    }
}
