package com.linggate.core.rule;

/**
 * 规则文件中的具名判定引用（YAML 标签 {@code !predicate name}），构建规则表时解析为具体判定
 */
public record PredicateReference(String name) {
}
