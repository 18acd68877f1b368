package com.minicall.calling.command;

import com.minicall.calling.conversation.ConversationDirectory;
import com.minicall.calling.conversation.ConversationInfo;
import com.minicall.calling.model.ActiveCallState;
import com.minicall.calling.model.CallEndedReason;
import com.minicall.calling.model.CallState;
import com.minicall.calling.model.CallingState;
import com.minicall.calling.model.GroupCall;
import com.minicall.calling.model.GroupCallConnectionState;
import com.minicall.calling.model.GroupCallJoinState;
import com.minicall.calling.model.GroupCallParticipant;
import com.minicall.calling.model.PeekInfo;
import com.minicall.calling.peek.PeekCoordinator;
import com.minicall.calling.store.CallSessionStore;
import com.minicall.calling.store.CallingEvent;
import com.minicall.config.CallingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 网络层 / 媒体层推送的事件入口：翻译成状态迁移，必要时触发 peek。
 *
 * <p>这些事件可能晚于用户操作到达，过期的部分由 reducer 丢弃，这里不做校验也不抛异常。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallingInboundHandler {

    private final CallSessionStore store;
    private final ConversationDirectory conversations;
    private final PeekCoordinator peekCoordinator;
    private final CallingEffectRunner effects;
    private final CallingCommandService commands;
    private final CallingProperties props;

    public void onIncomingDirectCall(String conversationId, boolean videoCall) {
        dispatch(new CallingEvent.IncomingDirectCall(conversationId, videoCall));
    }

    public void onIncomingGroupCall(String conversationId, long ringId, String ringerId) {
        dispatch(new CallingEvent.IncomingGroupCall(conversationId, ringId, ringerId));
    }

    public void onCancelRing(String conversationId, long ringId) {
        dispatch(new CallingEvent.CancelRing(conversationId, ringId));
    }

    /** 对端或其他设备发起的单聊外呼。 */
    public void onOutgoingCall(String conversationId, boolean hasLocalAudio, boolean hasLocalVideo) {
        dispatch(new CallingEvent.OutgoingCall(conversationId, hasLocalAudio, hasLocalVideo));
    }

    public void onCallStateChange(String conversationId, CallState callState, CallEndedReason reason, Long acceptedTime) {
        if (callState == CallState.ENDED) {
            log.info("calling inbound: direct call ended, conversationId={}, reason={}", conversationId, reason);
        }
        dispatch(new CallingEvent.CallStateChange(conversationId, callState, reason, acceptedTime));
    }

    public void onGroupCallStateChange(String conversationId,
                                       GroupCallConnectionState connectionState,
                                       GroupCallJoinState joinState,
                                       boolean hasLocalAudio,
                                       boolean hasLocalVideo,
                                       PeekInfo peekInfo,
                                       List<GroupCallParticipant> remoteParticipants) {
        dispatch(new CallingEvent.GroupCallStateChange(conversationId, connectionState, joinState,
                hasLocalAudio, hasLocalVideo, peekInfo, remoteParticipants, props.ourIdEffective()));
    }

    public void onPeekFulfilled(String conversationId, PeekInfo peekInfo) {
        dispatch(new CallingEvent.PeekFulfilled(conversationId, peekInfo));
    }

    public void onGroupCallAudioLevels(String conversationId, double localAudioLevel,
                                       List<CallingEvent.RemoteDeviceAudioLevel> remoteDeviceStates) {
        dispatch(new CallingEvent.AudioLevelsChange(conversationId, localAudioLevel, remoteDeviceStates));
    }

    public void onRemoteVideoChange(String conversationId, boolean hasVideo) {
        dispatch(new CallingEvent.RemoteVideoChange(conversationId, hasVideo));
    }

    public void onRemoteSharingScreenChange(String conversationId, boolean sharingScreen) {
        dispatch(new CallingEvent.RemoteSharingScreenChange(conversationId, sharingScreen));
    }

    /**
     * 某个成员的安全码变化：若该成员在前台群通话里，标记通话为不可信。
     */
    public void onSafetyNumberChanged(String memberId) {
        CallingState state = store.getState();
        ActiveCallState active = state.getActiveCallState();
        if (active == null) {
            return;
        }
        GroupCall call = state.getGroupCall(active.conversationId());
        if (call == null) {
            return;
        }
        Set<String> changed = new LinkedHashSet<>(active.safetyNumberChangedMemberIds());
        for (GroupCallParticipant participant : call.remoteParticipants()) {
            if (Objects.equals(participant.memberId(), memberId)) {
                changed.add(participant.memberId());
            }
        }
        if (!changed.isEmpty()) {
            dispatch(new CallingEvent.MarkCallUntrusted(changed));
        }
    }

    public void onSafetyNumberConfirmed(String conversationId) {
        commands.keyChangeOk(conversationId);
    }

    /**
     * 会话元数据变化：更新目录，并重新判断前台通话是否“太大不能响铃”。
     */
    public void onConversationChanged(ConversationInfo info) {
        if (info == null || info.conversationId() == null) {
            return;
        }
        conversations.put(info);
        dispatch(new CallingEvent.ConversationChanged(info.conversationId(), conversations.isTooBigToRing(info)));
    }

    public void onConversationRemoved(String conversationId) {
        conversations.remove(conversationId);
        dispatch(new CallingEvent.RemoveConversation(conversationId));
    }

    /** 群成员变化通知（可能成批到达）。 */
    public void onGroupCallMembershipChanged(String conversationId) {
        peekCoordinator.requestPeek(conversationId);
    }

    public void peekForTheFirstTime(String conversationId) {
        peekCoordinator.peekForTheFirstTime(conversationId);
    }

    public void peekIfItHasMembers(String conversationId) {
        peekCoordinator.peekIfItHasMembers(conversationId);
    }

    private void dispatch(CallingEvent event) {
        effects.run(store.dispatch(event));
    }
}
