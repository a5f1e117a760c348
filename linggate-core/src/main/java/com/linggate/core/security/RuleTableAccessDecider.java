package com.linggate.core.security;

import com.linggate.api.context.CallContext;
import com.linggate.api.security.AccessDecider;
import com.linggate.core.rule.RuleList;
import com.linggate.core.rule.RuleTable;

import java.util.Set;
import java.util.concurrent.CompletionStage;

/**
 * 默认放行判定：查规则表，任意一条规则匹配即放行
 */
public class RuleTableAccessDecider implements AccessDecider {

    private final RuleTable ruleTable;
    private final RuleMatcher matcher;

    public RuleTableAccessDecider(RuleTable ruleTable, RuleMatcher matcher) {
        this.ruleTable = ruleTable;
        this.matcher = matcher;
    }

    @Override
    public CompletionStage<Boolean> isAllowed(CallContext context, Set<String> roles) {
        return isAllowed(context.getServiceFullName(), context.getMethodName(), roles, context);
    }

    public CompletionStage<Boolean> isAllowed(String serviceFullName, String methodName,
                                              Set<String> roles, CallContext context) {
        RuleList rules = ruleTable.resolveRules(serviceFullName, methodName);
        return matcher.anyMatch(rules, roles, context);
    }
}
