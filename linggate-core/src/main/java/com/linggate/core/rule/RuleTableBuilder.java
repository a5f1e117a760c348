package com.linggate.core.rule;

import com.linggate.api.exception.RulesLoadException;
import com.linggate.api.security.RulePredicate;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 规则表构建器
 * 职责：把用户编写的原始规则（服务 -> 方法 -> 规则或规则列表）一次性归一化为 {@link RuleTable}
 * <p>
 * 不做规则值校验：无法识别的值归类为永不匹配的规则，而不是构建错误。
 * 唯一的构建期错误是引用了未注册的具名判定。
 * </p>
 */
@Slf4j
public class RuleTableBuilder {

    private final Map<String, RulePredicate> namedPredicates;

    public RuleTableBuilder() {
        this(Collections.emptyMap());
    }

    public RuleTableBuilder(Map<String, RulePredicate> namedPredicates) {
        this.namedPredicates = namedPredicates != null ? namedPredicates : Collections.emptyMap();
    }

    public RuleTable build(Map<?, ?> rawRules) {
        if (rawRules == null || rawRules.isEmpty()) {
            return RuleTable.empty();
        }
        Map<String, ServiceEntry> entries = new LinkedHashMap<>();
        rawRules.forEach((serviceName, raw) -> entries.put(String.valueOf(serviceName), normalizeService(raw)));

        RuleTable table = new RuleTable(entries);
        log.info("[LingGate] Rule table built: services={}, default={}", table.size(), table.getDefaultRules());
        return table;
    }

    /**
     * 服务级：映射 -> 方法级规则；列表 -> 原样；单条 -> 单元素列表
     */
    ServiceEntry normalizeService(Object raw) {
        if (raw instanceof ServiceEntry entry) {
            return entry;
        }
        if (raw instanceof Map<?, ?> methods) {
            Map<String, RuleList> rulesForMethod = new LinkedHashMap<>();
            methods.forEach((methodName, value) -> rulesForMethod.put(String.valueOf(methodName), normalizeList(value)));
            return new MethodRules(rulesForMethod);
        }
        return normalizeList(raw);
    }

    /**
     * 方法级：列表 -> 原样；其余 -> 单元素列表
     */
    RuleList normalizeList(Object raw) {
        if (raw instanceof RuleList rules) {
            return rules;
        }
        if (raw instanceof Collection<?> items) {
            List<AccessRule> rules = new ArrayList<>(items.size());
            for (Object item : items) {
                rules.add(normalizeRule(item));
            }
            return new RuleList(rules);
        }
        if (raw instanceof Object[] items) {
            List<AccessRule> rules = new ArrayList<>(items.length);
            for (Object item : items) {
                rules.add(normalizeRule(item));
            }
            return new RuleList(rules);
        }
        return RuleList.of(normalizeRule(raw));
    }

    AccessRule normalizeRule(Object raw) {
        if (raw instanceof PredicateReference ref) {
            RulePredicate predicate = namedPredicates.get(ref.name());
            if (predicate == null) {
                throw new RulesLoadException("Unknown predicate '" + ref.name()
                        + "'. Registered predicates: " + namedPredicates.keySet());
            }
            return AccessRule.predicate(ref.name(), predicate);
        }
        AccessRule rule = AccessRule.of(raw);
        if (rule instanceof AccessRule.Malformed) {
            log.debug("Unrecognized rule value [{}], it will never match", raw);
        }
        return rule;
    }
}
