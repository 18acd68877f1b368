package com.minicall.calling.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 通话状态的不可变快照：会话 -> 通话记录，加上至多一个前台通话。
 *
 * <p>只能由 {@code CallSessionStore} 通过状态迁移替换，其他组件只读。</p>
 */
@Slf4j
public record CallingState(Map<String, CallRecord> callsByConversation, ActiveCallState activeCallState) {

    private static final CallingState EMPTY = new CallingState(Map.of(), null);

    public CallingState {
        callsByConversation = callsByConversation == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(callsByConversation));
    }

    public static CallingState empty() {
        return EMPTY;
    }

    public CallRecord getCall(String conversationId) {
        return conversationId == null ? null : callsByConversation.get(conversationId);
    }

    public GroupCall getGroupCall(String conversationId) {
        return getCall(conversationId) instanceof GroupCall g ? g : null;
    }

    public DirectCall getDirectCall(String conversationId) {
        return getCall(conversationId) instanceof DirectCall d ? d : null;
    }

    /**
     * 前台通话对应的记录。
     *
     * <p>前台状态指向不存在的记录属于编程错误：开启断言时直接失败，否则记录日志并按“没有前台通话”处理。</p>
     */
    @JsonIgnore
    public CallRecord getActiveCall() {
        if (activeCallState == null) {
            return null;
        }
        CallRecord call = callsByConversation.get(activeCallState.conversationId());
        if (call == null) {
            String msg = "active call references missing conversation " + activeCallState.conversationId();
            assert false : msg;
            log.error("calling state invariant violated: {}", msg);
        }
        return call;
    }

    /**
     * 仅当前台状态有效时返回它，否则返回 null。
     */
    @JsonIgnore
    public ActiveCallState getActiveCallState() {
        return getActiveCall() == null ? null : activeCallState;
    }

    public boolean isActive(String conversationId) {
        return activeCallState != null && activeCallState.conversationId().equals(conversationId);
    }

    public CallingState withCall(CallRecord call) {
        Map<String, CallRecord> next = new LinkedHashMap<>(callsByConversation);
        next.put(call.conversationId(), call);
        return new CallingState(next, activeCallState);
    }

    public CallingState withActiveCallState(ActiveCallState value) {
        return new CallingState(callsByConversation, value);
    }

    public CallingState withCallAndActive(CallRecord call, ActiveCallState value) {
        Map<String, CallRecord> next = new LinkedHashMap<>(callsByConversation);
        next.put(call.conversationId(), call);
        return new CallingState(next, value);
    }

    /**
     * 删除会话的记录；若它是前台通话，同时清掉前台状态。
     */
    public CallingState withoutConversation(String conversationId) {
        Map<String, CallRecord> next = new LinkedHashMap<>(callsByConversation);
        next.remove(conversationId);
        return new CallingState(next, isActive(conversationId) ? null : activeCallState);
    }
}
