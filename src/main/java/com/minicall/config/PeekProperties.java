package com.minicall.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "im.calling.peek")
public record PeekProperties(
        Integer debounceMs,
        Integer afterHangUpDelayMs
) {

    /**
     * 发起 peek 前的静默等待。刚收到成员变化通知时立即 peek 往往拿到旧数据（尤其是有人离开时）。
     */
    public int debounceMsEffective() {
        Integer v = debounceMs;
        if (v == null) {
            return 1000;
        }
        return Math.max(0, v);
    }

    /** 群通话挂断后，留给断开流程的时间。 */
    public int afterHangUpDelayMsEffective() {
        Integer v = afterHangUpDelayMs;
        if (v == null) {
            return 1000;
        }
        return Math.max(0, v);
    }
}
