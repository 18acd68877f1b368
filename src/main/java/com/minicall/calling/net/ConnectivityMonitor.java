package com.minicall.calling.net;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * 网络连通性开关，由外层网络模块在上线/断网时调用 {@link #setOnline(boolean)}。
 *
 * <p>{@link #awaitOnline()} 在在线时立即完成，离线时挂起到下一次上线。</p>
 */
@Slf4j
@Component
public class ConnectivityMonitor {

    private final Object lock = new Object();

    private boolean online = true;
    private CompletableFuture<Void> onlineFuture = CompletableFuture.completedFuture(null);

    public boolean isOnline() {
        synchronized (lock) {
            return online;
        }
    }

    public void setOnline(boolean value) {
        CompletableFuture<Void> toComplete = null;
        synchronized (lock) {
            if (online == value) {
                return;
            }
            online = value;
            if (value) {
                toComplete = onlineFuture;
            } else {
                onlineFuture = new CompletableFuture<>();
            }
        }
        log.info("connectivity changed: online={}", value);
        if (toComplete != null) {
            toComplete.complete(null);
        }
    }

    public CompletableFuture<Void> awaitOnline() {
        synchronized (lock) {
            // 返回副本，调用方无法替我们完成或取消共享 future
            return onlineFuture.copy();
        }
    }
}
