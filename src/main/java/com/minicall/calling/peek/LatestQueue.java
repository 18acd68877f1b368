package com.minicall.calling.peek;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 至多一个运行中任务 + 至多一个待执行任务的队列。
 *
 * <ul>
 *   <li>空闲时 {@link #add} 立即调度该任务</li>
 *   <li>运行中再 {@link #add}：替换待执行任务（只保留最新的一个），当前任务结束后再跑它</li>
 *   <li>运行中任务结束且没有待执行任务时，回调 {@code onIdle}</li>
 * </ul>
 *
 * <p>任务异常只记日志，不影响后续任务。</p>
 */
@Slf4j
public final class LatestQueue {

    private final Object lock = new Object();
    private final Executor executor;
    private final Consumer<LatestQueue> onIdle;

    private boolean running;
    private Supplier<? extends CompletionStage<?>> pending;

    public LatestQueue(Executor executor, Consumer<LatestQueue> onIdle) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.onIdle = onIdle;
    }

    public void add(Supplier<? extends CompletionStage<?>> task) {
        Objects.requireNonNull(task, "task");
        synchronized (lock) {
            if (running) {
                pending = task;
                return;
            }
            running = true;
        }
        launch(task);
    }

    public boolean isIdle() {
        synchronized (lock) {
            return !running && pending == null;
        }
    }

    private void launch(Supplier<? extends CompletionStage<?>> task) {
        try {
            executor.execute(() -> safeGet(task).whenComplete((v, e) -> {
                if (e != null) {
                    log.warn("latest queue task failed: cause={}", e.toString());
                }
                onTaskDone();
            }));
        } catch (RejectedExecutionException e) {
            log.warn("latest queue task rejected: cause={}", e.toString());
            onTaskDone();
        }
    }

    private void onTaskDone() {
        Supplier<? extends CompletionStage<?>> next;
        synchronized (lock) {
            next = pending;
            pending = null;
            if (next == null) {
                running = false;
            }
        }
        if (next != null) {
            launch(next);
            return;
        }
        if (onIdle != null) {
            try {
                onIdle.accept(this);
            } catch (RuntimeException e) {
                log.warn("latest queue idle hook failed: cause={}", e.toString());
            }
        }
    }

    private static CompletableFuture<Void> safeGet(Supplier<? extends CompletionStage<?>> taskSupplier) {
        try {
            CompletionStage<?> stage = taskSupplier.get();
            if (stage == null) {
                return CompletableFuture.completedFuture(null);
            }
            return stage.thenRun(() -> {
            }).toCompletableFuture();
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }
}
