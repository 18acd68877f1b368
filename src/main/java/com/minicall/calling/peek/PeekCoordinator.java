package com.minicall.calling.peek;

import com.minicall.calling.conversation.ConversationDirectory;
import com.minicall.calling.model.CallMode;
import com.minicall.calling.model.CallRecord;
import com.minicall.calling.model.GroupCall;
import com.minicall.calling.model.GroupCallJoinState;
import com.minicall.calling.model.PeekInfo;
import com.minicall.calling.service.CallingService;
import com.minicall.calling.store.CallSessionStore;
import com.minicall.calling.store.CallingEvent;
import com.minicall.config.PeekProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * 群通话 peek 调度：每个会话一个 {@link LatestQueue}，保证同一会话同时最多一个 peek 在途，
 * 在途期间到达的请求合并成结束后的一次重跑。
 *
 * <p>每次 peek：检查 NotConnected -> 等静默期与网络在线 -> 再检查一次 -> 请求 -> 结果交给 store。
 * 失败只记日志，不重试；下一次触发自然会再 peek。</p>
 *
 * <p>队列空闲后立即从表中移除，长时间运行也不会累积。</p>
 */
@Slf4j
@Component
public class PeekCoordinator {

    private final CallSessionStore store;
    private final CallingService callingService;
    private final ConversationDirectory conversations;
    private final PeekGate gate;
    private final PeekProperties props;
    private final Executor executor;

    private final ConcurrentHashMap<String, LatestQueue> queues = new ConcurrentHashMap<>();
    private final Object queuesLock = new Object();

    public PeekCoordinator(CallSessionStore store,
                           CallingService callingService,
                           ConversationDirectory conversations,
                           PeekGate gate,
                           PeekProperties props,
                           @Qualifier("callingEventLoop") Executor executor) {
        this.store = store;
        this.callingService = callingService;
        this.conversations = conversations;
        this.gate = gate;
        this.props = props;
        this.executor = executor;
    }

    /**
     * 请求刷新一次成员快照。非群会话（或未知会话）直接忽略。
     */
    public void requestPeek(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            return;
        }
        CallMode mode = conversations.getCallMode(conversationId);
        if (mode != CallMode.GROUP) {
            log.debug("peek coordinator: not a group conversation, skip: conversationId={}, callMode={}",
                    conversationId, mode);
            return;
        }
        long debounceMs = props == null ? 1000 : props.debounceMsEffective();
        synchronized (queuesLock) {
            queues.computeIfAbsent(conversationId, k -> new LatestQueue(executor, q -> removeIfIdle(k, q)))
                    .add(() -> doPeek(conversationId, debounceMs));
        }
    }

    /** 先等 {@code delayMs} 再发起普通的 peek 请求（群通话挂断后使用）。 */
    public void requestPeekAfter(String conversationId, long delayMs) {
        gate.delay(delayMs).whenComplete((v, e) -> {
            if (e != null) {
                log.warn("peek coordinator: delayed peek dropped: conversationId={}, cause={}", conversationId, e.toString());
                return;
            }
            requestPeek(conversationId);
        });
    }

    /**
     * 还没有任何记录，或群通话记录还没有快照时才 peek。
     */
    public void peekForTheFirstTime(String conversationId) {
        CallRecord call = store.getState().getCall(conversationId);
        boolean shouldPeek = call == null || (call instanceof GroupCall g && g.peekInfo() == null);
        if (shouldPeek) {
            requestPeek(conversationId);
        }
    }

    /**
     * 未加入、且上次快照显示有设备在通话中时才 peek。
     */
    public void peekIfItHasMembers(String conversationId) {
        GroupCall call = store.getState().getGroupCall(conversationId);
        boolean shouldPeek = call != null
                && call.callMode() == CallMode.GROUP
                && call.joinState() == GroupCallJoinState.NOT_JOINED
                && call.peekInfo() != null
                && call.peekInfo().deviceCount() > 0;
        if (shouldPeek) {
            requestPeek(conversationId);
        }
    }

    public int queueCount() {
        return queues.size();
    }

    private void removeIfIdle(String conversationId, LatestQueue queue) {
        synchronized (queuesLock) {
            if (queue.isIdle()) {
                queues.remove(conversationId, queue);
            }
        }
    }

    private CompletableFuture<Void> doPeek(String conversationId, long debounceMs) {
        if (!PeekGuard.shouldPeek(store.getState(), conversationId)) {
            log.debug("peek coordinator: call is connected, skip: conversationId={}", conversationId);
            return CompletableFuture.completedFuture(null);
        }

        return gate.await(debounceMs)
                .thenCompose(ignored -> {
                    // 等待期间通话可能已连接
                    if (!PeekGuard.shouldPeek(store.getState(), conversationId)) {
                        log.debug("peek coordinator: call connected while waiting, skip: conversationId={}", conversationId);
                        return CompletableFuture.<PeekInfo>completedFuture(null);
                    }
                    return peekSafely(conversationId);
                })
                .handle((peekInfo, e) -> {
                    if (e != null) {
                        log.error("peek coordinator: group call peek failed: conversationId={}, cause={}",
                                conversationId, e.toString());
                        return null;
                    }
                    if (peekInfo != null) {
                        applyPeek(conversationId, peekInfo);
                    }
                    return null;
                });
    }

    private CompletableFuture<PeekInfo> peekSafely(String conversationId) {
        try {
            CompletableFuture<PeekInfo> f = callingService.peekGroupCall(conversationId);
            return f == null ? CompletableFuture.completedFuture(null) : f;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void applyPeek(String conversationId, PeekInfo peekInfo) {
        log.info("peek coordinator: found devices: conversationId={}, deviceCount={}",
                conversationId, peekInfo.deviceCount());

        GroupCall call = store.getState().getGroupCall(conversationId);
        GroupCallJoinState joinState = call == null ? null : call.joinState();
        try {
            CompletableFuture<Void> f = callingService.updateCallHistoryForGroupCall(conversationId, joinState, peekInfo);
            if (f != null) {
                f.whenComplete((v, e) -> {
                    if (e != null) {
                        log.warn("peek coordinator: call history update failed: conversationId={}, cause={}",
                                conversationId, e.toString());
                    }
                });
            }
        } catch (RuntimeException e) {
            log.warn("peek coordinator: call history update failed: conversationId={}, cause={}",
                    conversationId, e.toString());
        }

        store.dispatch(new CallingEvent.PeekFulfilled(conversationId, peekInfo));
    }
}
