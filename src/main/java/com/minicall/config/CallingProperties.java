package com.minicall.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 通话核心配置。
 *
 * @param ourId               本端成员 id（判断“是否有别人在群通话中”时排除自己）
 * @param outboundRingEnabled 是否允许群通话外呼响铃（总开关）
 * @param maxGroupRingSize    成员数达到该值的会话不响铃
 */
@ConfigurationProperties(prefix = "im.calling")
public record CallingProperties(
        String ourId,
        Boolean outboundRingEnabled,
        Integer maxGroupRingSize
) {

    public String ourIdEffective() {
        return ourId == null ? "" : ourId.trim();
    }

    public boolean outboundRingEnabledEffective() {
        return outboundRingEnabled == null || outboundRingEnabled;
    }

    public int maxGroupRingSizeEffective() {
        Integer v = maxGroupRingSize;
        if (v == null) {
            return 16;
        }
        return Math.max(1, v);
    }
}
