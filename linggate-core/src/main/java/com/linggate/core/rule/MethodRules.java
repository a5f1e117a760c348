package com.linggate.core.rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个服务的方法级规则：方法名 -> 规则列表
 */
public record MethodRules(Map<String, RuleList> methods) implements ServiceEntry {

    public MethodRules {
        methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
    }

    /**
     * @return 方法对应的规则，未配置返回 null
     */
    public RuleList get(String methodName) {
        return methods.get(methodName);
    }

    public boolean contains(String methodName) {
        return methods.containsKey(methodName);
    }

    @Override
    public String toString() {
        return methods.toString();
    }
}
