package com.minicall.calling.service;

import com.minicall.calling.conversation.ConversationDirectory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CallingServiceConfig {

    /**
     * 没有注册真实媒体层实现时，退回到只打日志的本地实现。
     */
    @Bean
    @ConditionalOnMissingBean(CallingService.class)
    public CallingService localCallingService(ConversationDirectory conversations) {
        return new LocalCallingService(conversations);
    }
}
