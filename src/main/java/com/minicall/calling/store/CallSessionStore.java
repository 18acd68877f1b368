package com.minicall.calling.store;

import com.minicall.calling.model.CallingState;
import com.minicall.config.CallingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * 通话状态的唯一持有者：会话 -> 通话记录，以及至多一个前台通话。
 *
 * <p>所有写入都经过 {@link #dispatch(CallingEvent)}：在同一把锁内按到达顺序应用 {@link CallingReducer}，
 * 同一会话的迁移不会乱序。迁移本身同步执行、从不阻塞；返回的副作用由调用方（命令层）在锁外执行。</p>
 *
 * <p>读取走 volatile 快照，无需加锁。</p>
 */
@Slf4j
@Component
public class CallSessionStore {

    private final Object lock = new Object();
    private final CallingReducer reducer;

    private volatile CallingState state = CallingState.empty();

    public CallSessionStore(CallingProperties props) {
        this(new CallingReducer(props == null || props.outboundRingEnabledEffective()));
        if (props == null || props.ourIdEffective().isEmpty()) {
            // 没有本端 id 时，快照里自己的设备也会被当成“别人”，外呼响铃会被提前关闭
            log.warn("calling store: im.calling.our-id is blank, own devices will count as other members");
        }
    }

    CallSessionStore(CallingReducer reducer) {
        this.reducer = Objects.requireNonNull(reducer, "reducer");
    }

    public CallingState getState() {
        return state;
    }

    public List<CallingEffect> dispatch(CallingEvent event) {
        Objects.requireNonNull(event, "event");
        Transition transition;
        synchronized (lock) {
            transition = reducer.reduce(state, event);
            state = transition.state();
        }
        if (log.isDebugEnabled()) {
            log.debug("calling store applied: event={}, calls={}, active={}",
                    event.getClass().getSimpleName(),
                    transition.state().callsByConversation().size(),
                    transition.state().activeCallState() == null ? null : transition.state().activeCallState().conversationId());
        }
        return transition.effects();
    }
}
