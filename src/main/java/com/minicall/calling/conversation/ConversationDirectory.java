package com.minicall.calling.conversation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.minicall.calling.model.CallMode;
import com.minicall.config.CallingProperties;
import com.minicall.config.ConversationCacheProperties;
import org.springframework.stereotype.Component;

/**
 * 基于 Caffeine 的会话元数据目录：由会话变化事件写入，供命令层与 peek 调度读取。
 *
 * <p>这里是会话元数据的唯一副本且无法回源，因此不设容量上限和过期，条目只在会话删除时移除。</p>
 */
@Component
public class ConversationDirectory {

    private final Cache<String, ConversationInfo> cache;
    private final int maxGroupRingSize;

    public ConversationDirectory(ConversationCacheProperties props, CallingProperties callingProps) {
        this.cache = Caffeine.newBuilder()
                .initialCapacity(Math.max(1, props.getInitialCapacity()))
                .build();
        this.maxGroupRingSize = callingProps == null ? 16 : callingProps.maxGroupRingSizeEffective();
    }

    public ConversationInfo get(String conversationId) {
        return conversationId == null ? null : cache.getIfPresent(conversationId);
    }

    public void put(ConversationInfo info) {
        cache.put(info.conversationId(), info);
    }

    public void remove(String conversationId) {
        cache.invalidate(conversationId);
    }

    public long size() {
        return cache.estimatedSize();
    }

    /** 未知会话返回 null。 */
    public CallMode getCallMode(String conversationId) {
        ConversationInfo info = get(conversationId);
        return info == null ? null : info.callMode();
    }

    public boolean isTooBigToRing(String conversationId) {
        return isTooBigToRing(get(conversationId));
    }

    public boolean isTooBigToRing(ConversationInfo info) {
        return info != null && info.callMode() == CallMode.GROUP && info.memberCount() >= maxGroupRingSize;
    }
}
