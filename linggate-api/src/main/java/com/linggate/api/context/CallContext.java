package com.linggate.api.context;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;

/**
 * 调用上下文：一次 RPC 调用交给鉴权网关的唯一“通行证”
 * <p>
 * 由传输层（gRPC Server、消息总线等）在调用进入时构建，构建后不可变，
 * 可以安全地在异步阶段之间传递。
 * </p>
 *
 * @author LingGate
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "token")
public class CallContext {

    // 调用身份
    private final String serviceFullName; // 如 svc.Greeter
    private final String methodName;      // 如 sayHello

    // 认证凭证 (对核心层不透明，可能是 JWT 字符串、解析后的 Claims 等)
    private final Object token;

    // 扩展信息 (Header、Peer 地址等)
    @Builder.Default
    private final Map<String, Object> metadata = Collections.emptyMap();

    public static CallContext of(String serviceFullName, String methodName, Object token) {
        return CallContext.builder()
                .serviceFullName(serviceFullName)
                .methodName(methodName)
                .token(token)
                .build();
    }

    /**
     * 完整方法名，格式 serviceFullName.methodName
     */
    public String getMethodFullName() {
        return serviceFullName + "." + methodName;
    }

    public boolean hasToken() {
        if (token == null) return false;
        if (token instanceof CharSequence cs) return cs.length() > 0;
        return true;
    }
}
