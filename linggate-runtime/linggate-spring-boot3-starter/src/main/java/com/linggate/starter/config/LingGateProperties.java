package com.linggate.starter.config;

import com.linggate.core.config.AuthorizerOptions;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Setter
@Getter
@ConfigurationProperties(prefix = "linggate")
public class LingGateProperties {

    /**
     * 是否启用鉴权自动装配
     */
    private boolean enabled = true;

    /**
     * 规则文件路径，相对路径基于工作目录；支持 classpath: 前缀
     */
    private String rulesFile = AuthorizerOptions.DEFAULT_RULES_FILE;

}
