package com.linggate.sample.service;

import com.linggate.api.context.CallContext;
import com.linggate.core.kernel.AuthorizationInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Greeter 服务入口：每次调用先经过鉴权拦截器
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GreeterGateway {

    public static final String SERVICE_NAME = "myapp.Greeter";

    private final AuthorizationInterceptor interceptor;
    private final GreeterService greeterService;

    public CompletableFuture<String> call(String method, String name, Object token) {
        return call(method, name, token, Map.of());
    }

    public CompletableFuture<String> call(String method, String name, Object token, Map<String, Object> metadata) {
        Function<String, String> target = resolve(method);
        CallContext context = CallContext.builder()
                .serviceFullName(SERVICE_NAME)
                .methodName(method)
                .token(token)
                .metadata(metadata)
                .build();
        log.debug("Dispatching {}", context);
        return interceptor.intercept(context, () -> CompletableFuture.completedFuture(target.apply(name)));
    }

    private Function<String, String> resolve(String method) {
        return switch (method) {
            case "sayHello" -> greeterService::sayHello;
            case "sayHelloOther" -> greeterService::sayHelloOther;
            case "sayHelloRealm" -> greeterService::sayHelloRealm;
            case "sayHelloCustom" -> greeterService::sayHelloCustom;
            case "sayHelloPublic" -> greeterService::sayHelloPublic;
            case "sayHelloMultiple" -> greeterService::sayHelloMultiple;
            case "sayGoodbye" -> greeterService::sayGoodbye;
            default -> throw new IllegalArgumentException("Unknown method: " + SERVICE_NAME + "." + method);
        };
    }
}
