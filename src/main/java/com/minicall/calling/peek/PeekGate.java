package com.minicall.calling.peek;

import com.minicall.calling.net.ConnectivityMonitor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * peek 发起前的等待条件：静默期定时器 + 网络在线。
 */
@Component
public class PeekGate {

    private final ScheduledExecutorService scheduler;
    private final ConnectivityMonitor connectivity;

    public PeekGate(@Qualifier("callingEventLoop") ScheduledExecutorService scheduler, ConnectivityMonitor connectivity) {
        this.scheduler = scheduler;
        this.connectivity = connectivity;
    }

    /**
     * 先等满 {@code delayMs}，再等网络在线；两者都满足后完成。
     */
    public CompletableFuture<Void> await(long delayMs) {
        return delay(delayMs).thenCompose(ignored -> connectivity.awaitOnline());
    }

    public CompletableFuture<Void> delay(long delayMs) {
        if (delayMs <= 0) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> out = new CompletableFuture<>();
        try {
            scheduler.schedule(() -> out.complete(null), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            out.completeExceptionally(e);
        }
        return out;
    }
}
