package com.linggate.starter.configuration;

import com.linggate.api.security.AccessDecider;
import com.linggate.api.security.AuthenticationVerifier;
import com.linggate.api.security.PermissionResolver;
import com.linggate.api.security.RulePredicate;
import com.linggate.core.audit.AuthorizationListener;
import com.linggate.core.config.AuthorizerOptions;
import com.linggate.core.kernel.AuthorizationInterceptor;
import com.linggate.core.kernel.Authorizer;
import com.linggate.starter.config.LingGateProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.Collections;
import java.util.Map;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(LingGateProperties.class)
@ConditionalOnProperty(prefix = "linggate", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LingGateAutoConfiguration {

    // 组装鉴权器：容器中提供的协作者优先，否则使用默认实现
    @Bean
    @ConditionalOnMissingBean
    public Authorizer authorizer(LingGateProperties properties,
                                 ObjectProvider<Map<String, RulePredicate>> predicatesProvider,
                                 ObjectProvider<PermissionResolver> permissionResolverProvider,
                                 ObjectProvider<AuthenticationVerifier> authenticationVerifierProvider,
                                 ObjectProvider<AccessDecider> accessDeciderProvider,
                                 ObjectProvider<AuthorizationListener> listenerProvider) {

        // 具名判定按 Bean 名称注册，供 !predicate 引用
        Map<String, RulePredicate> predicates = predicatesProvider.getIfAvailable(Collections::emptyMap);

        AuthorizerOptions.AuthorizerOptionsBuilder builder = AuthorizerOptions.builder()
                .rulesFile(properties.getRulesFile())
                .predicates(predicates)
                .accessDecider(accessDeciderProvider.getIfAvailable());
        permissionResolverProvider.ifAvailable(builder::permissionResolver);
        authenticationVerifierProvider.ifAvailable(builder::authenticationVerifier);
        listenerProvider.ifAvailable(builder::listener);

        log.info("[LingGate] Auto-configuring authorizer: rulesFile={}, predicates={}",
                properties.getRulesFile(), predicates.keySet());
        return new Authorizer(builder.build());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthorizationInterceptor authorizationInterceptor(Authorizer authorizer) {
        return authorizer.getInterceptor();
    }
}
