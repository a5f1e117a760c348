package com.linggate.core.rule;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 规则表 (Immutable)
 * <p>
 * 构建后只读，可被任意数量的并发调用无锁共享。
 * 保留键 {@code default} 是全局兜底规则，与具体服务无关。
 * </p>
 */
@EqualsAndHashCode
public final class RuleTable {

    public static final String DEFAULT_KEY = "default";

    private static final RuleTable EMPTY = new RuleTable(Collections.emptyMap());

    private final Map<String, ServiceEntry> entries;

    public RuleTable(Map<String, ServiceEntry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static RuleTable empty() {
        return EMPTY;
    }

    /**
     * 查找某个方法适用的规则
     * <ol>
     * <li>服务存在方法级规则且包含该方法：返回该方法的规则（空列表同样直接返回，视为显式拒绝）</li>
     * <li>存在平铺的 default 规则：返回 default</li>
     * <li>否则返回空列表（默认拒绝）</li>
     * </ol>
     */
    public RuleList resolveRules(String serviceFullName, String methodName) {
        ServiceEntry entry = entries.get(serviceFullName);
        if (entry instanceof MethodRules methodRules) {
            RuleList rules = methodRules.get(methodName);
            if (rules != null) return rules;
        }
        return getDefaultRules();
    }

    /**
     * 全局兜底规则；未配置，或 default 被写成了方法级映射时返回空列表
     */
    public RuleList getDefaultRules() {
        if (entries.get(DEFAULT_KEY) instanceof RuleList defaults) {
            return defaults;
        }
        return RuleList.empty();
    }

    public boolean hasDefault() {
        return entries.containsKey(DEFAULT_KEY);
    }

    public ServiceEntry getEntry(String serviceFullName) {
        return entries.get(serviceFullName);
    }

    public Map<String, ServiceEntry> getEntries() {
        return entries;
    }

    public Set<String> services() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "RuleTable" + entries;
    }
}
