package com.minicall.calling.store;

import com.minicall.calling.model.CallEndedReason;
import com.minicall.calling.model.CallMode;
import com.minicall.calling.model.CallState;
import com.minicall.calling.model.GroupCallConnectionState;
import com.minicall.calling.model.GroupCallJoinState;
import com.minicall.calling.model.GroupCallParticipant;
import com.minicall.calling.model.PeekInfo;
import com.minicall.calling.model.PresentedSource;

import java.util.List;
import java.util.Set;

/**
 * 驱动 {@link CallingReducer} 的事件。每种事件对应一种状态迁移，由 {@link CallSessionStore} 按到达顺序串行应用。
 */
public interface CallingEvent {

    /**
     * 进入通话大厅。群通话会保留已有记录上的 peek 快照和响铃子状态。
     */
    record StartLobby(
            String conversationId,
            CallMode callMode,
            boolean hasLocalAudio,
            boolean hasLocalVideo,
            GroupCallConnectionState connectionState,
            GroupCallJoinState joinState,
            PeekInfo peekInfo,
            List<GroupCallParticipant> remoteParticipants,
            boolean conversationTooBigToRing
    ) implements CallingEvent {

        public static StartLobby direct(String conversationId, boolean hasLocalAudio, boolean hasLocalVideo) {
            return new StartLobby(conversationId, CallMode.DIRECT, hasLocalAudio, hasLocalVideo,
                    null, null, null, List.of(), false);
        }
    }

    record StartDirectCall(String conversationId, boolean hasLocalAudio, boolean hasLocalVideo) implements CallingEvent {
    }

    record OutgoingCall(String conversationId, boolean hasLocalAudio, boolean hasLocalVideo) implements CallingEvent {
    }

    record AcceptCallPending(String conversationId, boolean asVideoCall) implements CallingEvent {
    }

    record IncomingDirectCall(String conversationId, boolean videoCall) implements CallingEvent {
    }

    record IncomingGroupCall(String conversationId, long ringId, String ringerId) implements CallingEvent {
    }

    record CallStateChange(
            String conversationId,
            CallState callState,
            CallEndedReason callEndedReason,
            Long acceptedTime
    ) implements CallingEvent {
    }

    record GroupCallStateChange(
            String conversationId,
            GroupCallConnectionState connectionState,
            GroupCallJoinState joinState,
            boolean hasLocalAudio,
            boolean hasLocalVideo,
            PeekInfo peekInfo,
            List<GroupCallParticipant> remoteParticipants,
            String ourId
    ) implements CallingEvent {
    }

    record PeekFulfilled(String conversationId, PeekInfo peekInfo) implements CallingEvent {
    }

    record AudioLevelsChange(
            String conversationId,
            double localAudioLevel,
            List<RemoteDeviceAudioLevel> remoteDeviceStates
    ) implements CallingEvent {
    }

    /** {@code audioLevel} 可能缺失（null），此时忽略该设备。 */
    record RemoteDeviceAudioLevel(int demuxId, Double audioLevel) {
    }

    record CancelRing(String conversationId, long ringId) implements CallingEvent {
    }

    /** 会话被删除：无论状态如何都移除记录。 */
    record RemoveConversation(String conversationId) implements CallingEvent {
    }

    record DeclineDirectCall(String conversationId) implements CallingEvent {
    }

    /** 本地挂断前台通话。 */
    record HangUp() implements CallingEvent {
    }

    /** 在大厅阶段取消前台通话。 */
    record CancelCall() implements CallingEvent {
    }

    record CloseNeedPermissionScreen() implements CallingEvent {
    }

    record ConversationChanged(String conversationId, boolean tooBigToRing) implements CallingEvent {
    }

    record RemoteVideoChange(String conversationId, boolean hasVideo) implements CallingEvent {
    }

    record RemoteSharingScreenChange(String conversationId, boolean sharingScreen) implements CallingEvent {
    }

    record ReturnToActiveCall() implements CallingEvent {
    }

    record SetLocalAudio(boolean enabled) implements CallingEvent {
    }

    record SetLocalVideo(boolean enabled) implements CallingEvent {
    }

    record TogglePip() implements CallingEvent {
    }

    record ToggleSettings() implements CallingEvent {
    }

    record ToggleParticipants() implements CallingEvent {
    }

    record ToggleSpeakerView() implements CallingEvent {
    }

    record SwitchToPresentationView() implements CallingEvent {
    }

    record SwitchFromPresentationView() implements CallingEvent {
    }

    /** {@code source} 为 null 表示停止共享。 */
    record SetPresenting(PresentedSource source) implements CallingEvent {
    }

    record SetOutgoingRing(boolean outgoingRing) implements CallingEvent {
    }

    record MarkCallUntrusted(Set<String> safetyNumberChangedMemberIds) implements CallingEvent {
    }

    record MarkCallTrusted() implements CallingEvent {
    }
}
