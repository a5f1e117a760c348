package com.linggate.starter.configuration;

import com.linggate.api.context.CallContext;
import com.linggate.api.exception.PermissionDeniedException;
import com.linggate.api.exception.RulesLoadException;
import com.linggate.api.security.PermissionResolver;
import com.linggate.api.security.RulePredicate;
import com.linggate.core.config.AuthorizerOptions;
import com.linggate.core.kernel.AuthorizationInterceptor;
import com.linggate.core.kernel.Authorizer;
import com.linggate.starter.config.LingGateProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LingGateAutoConfiguration 装配测试")
class LingGateAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(LingGateAutoConfiguration.class))
            .withPropertyValues("linggate.rules-file=classpath:rules/starter-rules.yml")
            .withBean("ownsAccount", RulePredicate.class, () -> (ctx, token) -> "owner".equals(token));

    private static CallContext call(String method, Object token) {
        return CallContext.of("svc.Greeter", method, token);
    }

    @Test
    @DisplayName("默认装配 Authorizer 与 AuthorizationInterceptor")
    void shouldRegisterAuthorizerAndInterceptor() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(Authorizer.class);
            assertThat(context).hasSingleBean(AuthorizationInterceptor.class);
            assertThat(context.getBean(Authorizer.class).getRules().services())
                    .containsExactlyInAnyOrder("default", "svc.Greeter");
        });
    }

    @Test
    @DisplayName("属性默认值")
    void shouldBindDefaultProperties() {
        contextRunner.run(context -> {
            LingGateProperties properties = context.getBean(LingGateProperties.class);
            assertThat(properties.isEnabled()).isTrue();
            assertThat(new LingGateProperties().getRulesFile()).isEqualTo(AuthorizerOptions.DEFAULT_RULES_FILE);
        });
    }

    @Test
    @DisplayName("linggate.enabled=false 时不装配")
    void shouldBackOffWhenDisabled() {
        contextRunner.withPropertyValues("linggate.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(Authorizer.class);
                    assertThat(context).doesNotHaveBean(AuthorizationInterceptor.class);
                });
    }

    @Test
    @DisplayName("RulePredicate Bean 按名称供 !predicate 引用")
    void shouldResolvePredicateBeansByName() {
        contextRunner.run(context -> {
            Authorizer authorizer = context.getBean(Authorizer.class);
            assertThat(authorizer.isAllowed(call("sayHelloCustom", "owner"), Set.of())
                    .toCompletableFuture().join()).isTrue();
            assertThat(authorizer.isAllowed(call("sayHelloCustom", "guest"), Set.of())
                    .toCompletableFuture().join()).isFalse();
        });
    }

    @Test
    @DisplayName("容器中的 PermissionResolver 替换默认实现")
    void shouldUseProvidedPermissionResolver() {
        contextRunner.withBean(PermissionResolver.class,
                        () -> ctx -> CompletableFuture.completedFuture(Set.of("admin")))
                .run(context -> {
                    AuthorizationInterceptor interceptor = context.getBean(AuthorizationInterceptor.class);
                    String result = interceptor.intercept(call("sayHello", "t"),
                            () -> CompletableFuture.completedFuture("hello")).join();
                    assertThat(result).isEqualTo("hello");
                });
    }

    @Test
    @DisplayName("默认 PermissionResolver 不授予角色：code 7")
    void shouldDenyWithoutRoles() {
        contextRunner.run(context -> {
            AuthorizationInterceptor interceptor = context.getBean(AuthorizationInterceptor.class);
            assertThatThrownBy(() -> interceptor.intercept(call("sayHello", "t"),
                    () -> CompletableFuture.completedFuture("hello")).join())
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(PermissionDeniedException.class);
        });
    }

    @Test
    @DisplayName("用户自定义 Authorizer 时自动装配退让")
    void shouldBackOffForUserAuthorizer() {
        Authorizer custom = new Authorizer(AuthorizerOptions.withRules(Map.of("default", "$anonymous")));
        contextRunner.withBean(Authorizer.class, () -> custom)
                .run(context -> {
                    assertThat(context).hasSingleBean(Authorizer.class);
                    assertThat(context.getBean(Authorizer.class)).isSameAs(custom);
                });
    }

    @Test
    @DisplayName("引用未注册的判定时启动失败")
    void shouldFailOnUnknownPredicate() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(LingGateAutoConfiguration.class))
                .withPropertyValues("linggate.rules-file=classpath:rules/starter-rules.yml")
                .run(context -> assertThat(context).getFailure()
                        .hasRootCauseInstanceOf(RulesLoadException.class)
                        .rootCause().hasMessageContaining("ownsAccount"));
    }

    @Test
    @DisplayName("规则文件不存在时启动失败")
    void shouldFailOnMissingRulesFile() {
        contextRunner.withPropertyValues("linggate.rules-file=classpath:rules/missing.yml")
                .run(context -> assertThat(context).getFailure()
                        .hasRootCauseInstanceOf(RulesLoadException.class));
    }
}
