package com.linggate.core.rule;

/**
 * 规则表中某个服务名下的条目：要么是一组平铺规则，要么是按方法名划分的规则
 */
public sealed interface ServiceEntry permits RuleList, MethodRules {
}
