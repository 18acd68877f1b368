package com.minicall.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "im.calling.conversations")
public class ConversationCacheProperties {

    /** Caffeine 初始容量。 */
    private int initialCapacity = 64;

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public void setInitialCapacity(int initialCapacity) {
        this.initialCapacity = initialCapacity;
    }
}
