package com.minicall.calling.store;

/**
 * 音量分档：把 [0,1] 的原始音量压成少数几个档位，静音归零，避免底噪抖动触发刷新。
 */
public final class AudioLevels {

    private AudioLevels() {
    }

    public static double truncate(double raw) {
        if (Double.isNaN(raw) || raw <= 0.01) {
            return 0;
        }
        if (raw < 0.1) {
            return 0.25;
        }
        if (raw < 0.3) {
            return 0.5;
        }
        if (raw < 0.6) {
            return 0.75;
        }
        return 1;
    }
}
