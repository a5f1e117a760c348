package com.linggate.core.rule;

import com.linggate.api.security.AsyncRulePredicate;
import com.linggate.api.security.RulePredicate;

/**
 * 单条访问规则
 * <p>
 * 原始配置中的标量（字符串 / 函数）在构建规则表时一次性归类为以下变体之一，
 * 调用期不再做任何类型探测。
 * </p>
 */
public sealed interface AccessRule
        permits AccessRule.Anonymous, AccessRule.Authenticated, AccessRule.RoleName,
        AccessRule.Predicate, AccessRule.AsyncPredicate, AccessRule.Malformed {

    String ANONYMOUS = "$anonymous";
    String AUTHENTICATED = "$authenticated";

    static AccessRule anonymous() {
        return Anonymous.INSTANCE;
    }

    static AccessRule authenticated() {
        return Authenticated.INSTANCE;
    }

    static AccessRule role(String name) {
        return new RoleName(name);
    }

    static AccessRule predicate(RulePredicate function) {
        return new Predicate(null, function);
    }

    static AccessRule predicate(String name, RulePredicate function) {
        return new Predicate(name, function);
    }

    static AccessRule asyncPredicate(AsyncRulePredicate function) {
        return new AsyncPredicate(null, function);
    }

    /**
     * 归类一个原始标量。无法识别的值不会报错，而是成为永不匹配的 {@link Malformed}
     */
    static AccessRule of(Object raw) {
        if (raw instanceof AccessRule rule) return rule;
        if (raw instanceof CharSequence cs) {
            String value = cs.toString();
            if (ANONYMOUS.equals(value)) return Anonymous.INSTANCE;
            if (AUTHENTICATED.equals(value)) return Authenticated.INSTANCE;
            return new RoleName(value);
        }
        if (raw instanceof RulePredicate fn) return new Predicate(null, fn);
        if (raw instanceof AsyncRulePredicate fn) return new AsyncPredicate(null, fn);
        return new Malformed(raw);
    }

    // ===== 变体 =====

    /**
     * 永远放行
     */
    record Anonymous() implements AccessRule {
        static final Anonymous INSTANCE = new Anonymous();

        @Override
        public String toString() {
            return ANONYMOUS;
        }
    }

    /**
     * 已认证即放行
     */
    record Authenticated() implements AccessRule {
        static final Authenticated INSTANCE = new Authenticated();

        @Override
        public String toString() {
            return AUTHENTICATED;
        }
    }

    /**
     * 调用方拥有该角色即放行
     */
    record RoleName(String name) implements AccessRule {
        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * 自定义同步判定
     */
    record Predicate(String name, RulePredicate function) implements AccessRule {
        @Override
        public String toString() {
            return name != null ? "predicate(" + name + ")" : "predicate";
        }
    }

    /**
     * 自定义异步判定
     */
    record AsyncPredicate(String name, AsyncRulePredicate function) implements AccessRule {
        @Override
        public String toString() {
            return name != null ? "async-predicate(" + name + ")" : "async-predicate";
        }
    }

    /**
     * 无法识别的原始值（数字、null、嵌套对象等），永不匹配
     */
    record Malformed(Object raw) implements AccessRule {
        @Override
        public String toString() {
            return "malformed(" + raw + ")";
        }
    }
}
