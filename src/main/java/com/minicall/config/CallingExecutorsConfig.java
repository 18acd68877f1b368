package com.minicall.config;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        CallingProperties.class,
        PeekProperties.class,
        ConversationCacheProperties.class
})
public class CallingExecutorsConfig {

    /**
     * 单线程事件循环：peek 队列的任务调度、防抖定时器都在这里执行。
     */
    @Bean(name = "callingEventLoop", destroyMethod = "shutdownGracefully")
    public EventExecutor callingEventLoop() {
        return new DefaultEventExecutor(new DefaultThreadFactory("calling-loop", true));
    }
}
