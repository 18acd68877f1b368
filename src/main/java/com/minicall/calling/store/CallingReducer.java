package com.minicall.calling.store;

import com.minicall.calling.model.ActiveCallState;
import com.minicall.calling.model.CallMode;
import com.minicall.calling.model.CallRecord;
import com.minicall.calling.model.CallState;
import com.minicall.calling.model.CallViewMode;
import com.minicall.calling.model.CallingState;
import com.minicall.calling.model.DirectCall;
import com.minicall.calling.model.GroupCall;
import com.minicall.calling.model.GroupCallConnectionState;
import com.minicall.calling.model.GroupCallJoinState;
import com.minicall.calling.model.PeekInfo;
import com.minicall.calling.model.RingState;
import com.minicall.calling.store.CallingEvent.AcceptCallPending;
import com.minicall.calling.store.CallingEvent.AudioLevelsChange;
import com.minicall.calling.store.CallingEvent.CallStateChange;
import com.minicall.calling.store.CallingEvent.CancelCall;
import com.minicall.calling.store.CallingEvent.CancelRing;
import com.minicall.calling.store.CallingEvent.CloseNeedPermissionScreen;
import com.minicall.calling.store.CallingEvent.ConversationChanged;
import com.minicall.calling.store.CallingEvent.DeclineDirectCall;
import com.minicall.calling.store.CallingEvent.GroupCallStateChange;
import com.minicall.calling.store.CallingEvent.HangUp;
import com.minicall.calling.store.CallingEvent.IncomingDirectCall;
import com.minicall.calling.store.CallingEvent.IncomingGroupCall;
import com.minicall.calling.store.CallingEvent.MarkCallTrusted;
import com.minicall.calling.store.CallingEvent.MarkCallUntrusted;
import com.minicall.calling.store.CallingEvent.OutgoingCall;
import com.minicall.calling.store.CallingEvent.PeekFulfilled;
import com.minicall.calling.store.CallingEvent.RemoteDeviceAudioLevel;
import com.minicall.calling.store.CallingEvent.RemoteSharingScreenChange;
import com.minicall.calling.store.CallingEvent.RemoteVideoChange;
import com.minicall.calling.store.CallingEvent.RemoveConversation;
import com.minicall.calling.store.CallingEvent.ReturnToActiveCall;
import com.minicall.calling.store.CallingEvent.SetLocalAudio;
import com.minicall.calling.store.CallingEvent.SetLocalVideo;
import com.minicall.calling.store.CallingEvent.SetOutgoingRing;
import com.minicall.calling.store.CallingEvent.SetPresenting;
import com.minicall.calling.store.CallingEvent.StartDirectCall;
import com.minicall.calling.store.CallingEvent.StartLobby;
import com.minicall.calling.store.CallingEvent.SwitchFromPresentationView;
import com.minicall.calling.store.CallingEvent.SwitchToPresentationView;
import com.minicall.calling.store.CallingEvent.ToggleParticipants;
import com.minicall.calling.store.CallingEvent.TogglePip;
import com.minicall.calling.store.CallingEvent.ToggleSettings;
import com.minicall.calling.store.CallingEvent.ToggleSpeakerView;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * 通话状态机：{@code (state, event) -> (nextState, effects)}，无 IO、无阻塞。
 *
 * <p>约定：</p>
 * <ul>
 *   <li>过期事件（会话没有通话、没有前台通话、通话类型不符）返回原状态并打 warn，不抛异常；
 *       这些事件可能是晚到的网络事件与用户挂断赛跑的正常结果。</li>
 *   <li>状态未变化时返回同一个 {@link CallingState} 实例，调用方可以按引用判断。</li>
 * </ul>
 */
@Slf4j
public class CallingReducer {

    private final boolean outboundRingEnabled;

    public CallingReducer(boolean outboundRingEnabled) {
        this.outboundRingEnabled = outboundRingEnabled;
    }

    public Transition reduce(CallingState state, CallingEvent event) {
        Transition out = apply(state, event);
        CallingState checked = enforceInvariants(out.state());
        return checked == out.state() ? out : new Transition(checked, out.effects());
    }

    private Transition apply(CallingState state, CallingEvent event) {
        if (event instanceof StartLobby e) {
            return Transition.of(startLobby(state, e));
        }
        if (event instanceof StartDirectCall e) {
            return Transition.of(startDirect(state, e.conversationId(), e.hasLocalAudio(), e.hasLocalVideo()));
        }
        if (event instanceof OutgoingCall e) {
            return Transition.of(startDirect(state, e.conversationId(), e.hasLocalAudio(), e.hasLocalVideo()));
        }
        if (event instanceof AcceptCallPending e) {
            return Transition.of(acceptCallPending(state, e));
        }
        if (event instanceof HangUp) {
            return endActiveCall(state, true);
        }
        if (event instanceof CancelCall || event instanceof CloseNeedPermissionScreen) {
            return endActiveCall(state, false);
        }
        if (event instanceof CancelRing e) {
            return Transition.of(cancelRing(state, e));
        }
        if (event instanceof ConversationChanged e) {
            return Transition.of(conversationChanged(state, e));
        }
        if (event instanceof RemoveConversation e) {
            return Transition.of(removeConversation(state, e.conversationId()));
        }
        if (event instanceof DeclineDirectCall e) {
            return Transition.of(removeConversation(state, e.conversationId()));
        }
        if (event instanceof IncomingDirectCall e) {
            return incomingDirectCall(state, e);
        }
        if (event instanceof IncomingGroupCall e) {
            return Transition.of(incomingGroupCall(state, e));
        }
        if (event instanceof CallStateChange e) {
            return Transition.of(callStateChange(state, e));
        }
        if (event instanceof AudioLevelsChange e) {
            return Transition.of(audioLevelsChange(state, e));
        }
        if (event instanceof GroupCallStateChange e) {
            return Transition.of(groupCallStateChange(state, e));
        }
        if (event instanceof PeekFulfilled e) {
            return Transition.of(peekFulfilled(state, e));
        }
        if (event instanceof RemoteSharingScreenChange e) {
            return Transition.of(updateDirectCall(state, e.conversationId(), "remote sharing screen",
                    call -> call.withSharingScreen(e.sharingScreen())));
        }
        if (event instanceof RemoteVideoChange e) {
            return Transition.of(updateDirectCall(state, e.conversationId(), "remote video",
                    call -> call.withRemoteVideo(e.hasVideo())));
        }
        if (event instanceof ReturnToActiveCall) {
            return Transition.of(updateActive(state, "return to active call", a -> a.withPip(false)));
        }
        if (event instanceof SetLocalAudio e) {
            return Transition.of(updateActive(state, "set local audio", a -> a.withHasLocalAudio(e.enabled())));
        }
        if (event instanceof SetLocalVideo e) {
            return Transition.of(updateActive(state, "set local video", a -> a.withHasLocalVideo(e.enabled())));
        }
        if (event instanceof ToggleSettings) {
            return Transition.of(updateActive(state, "toggle settings",
                    a -> a.withSettingsDialogOpen(!a.settingsDialogOpen())));
        }
        if (event instanceof ToggleParticipants) {
            return Transition.of(updateActive(state, "toggle participants list",
                    a -> a.withShowParticipantsList(!a.showParticipantsList())));
        }
        if (event instanceof TogglePip) {
            return Transition.of(updateActive(state, "toggle pip", a -> a.withPip(!a.pip())));
        }
        if (event instanceof SetPresenting e) {
            return Transition.of(updateActive(state, "set presenting", a -> a.withPresentingSource(e.source())));
        }
        if (event instanceof SetOutgoingRing e) {
            return Transition.of(updateActive(state, "set outgoing ring", a -> a.withOutgoingRing(e.outgoingRing())));
        }
        if (event instanceof ToggleSpeakerView) {
            return Transition.of(updateActive(state, "toggle speaker view",
                    a -> a.withViewMode(a.viewMode() == CallViewMode.GRID ? CallViewMode.SPEAKER : CallViewMode.GRID)));
        }
        if (event instanceof SwitchToPresentationView) {
            // 演讲者视图下保持不变；共享结束后会回到网格
            return Transition.of(updateActive(state, "switch to presentation view",
                    a -> a.viewMode() == CallViewMode.SPEAKER ? a : a.withViewMode(CallViewMode.PRESENTATION)));
        }
        if (event instanceof SwitchFromPresentationView) {
            return Transition.of(updateActive(state, "switch from presentation view",
                    a -> a.viewMode() != CallViewMode.PRESENTATION ? a : a.withViewMode(CallViewMode.GRID)));
        }
        if (event instanceof MarkCallUntrusted e) {
            return Transition.of(updateActive(state, "mark call untrusted",
                    a -> a.withPip(false)
                            .withSafetyNumberChangedMemberIds(e.safetyNumberChangedMemberIds())
                            .withSettingsDialogOpen(false)
                            .withShowParticipantsList(false)));
        }
        if (event instanceof MarkCallTrusted) {
            return Transition.of(updateActive(state, "mark call trusted",
                    a -> a.safetyNumberChangedMemberIds().isEmpty() ? a : a.withSafetyNumberChangedMemberIds(null)));
        }
        log.warn("calling reducer: unhandled event {}", event == null ? null : event.getClass().getSimpleName());
        return Transition.of(state);
    }

    private CallingState startLobby(CallingState state, StartLobby e) {
        String conversationId = e.conversationId();
        if (e.callMode() == CallMode.DIRECT) {
            return state.withCallAndActive(
                    DirectCall.lobby(conversationId, e.hasLocalVideo()),
                    ActiveCallState.start(conversationId, e.hasLocalAudio(), e.hasLocalVideo(), true));
        }

        // 预期只短暂停留在这个形态，随后会被 group state change 覆盖
        GroupCall existing = state.getGroupCall(conversationId);
        GroupCallJoinState joinState = e.joinState() == null ? GroupCallJoinState.NOT_JOINED : e.joinState();
        // 响铃只在未加入时保留
        RingState ring = existing != null && joinState == GroupCallJoinState.NOT_JOINED ? existing.ring() : null;
        PeekInfo peekInfo = e.peekInfo();
        if (peekInfo == null) {
            peekInfo = existing != null && existing.peekInfo() != null
                    ? existing.peekInfo()
                    : PeekInfo.fromParticipants(e.remoteParticipants());
        }
        GroupCall call = new GroupCall(
                conversationId,
                e.callMode(),
                e.connectionState() == null ? GroupCallConnectionState.NOT_CONNECTED : e.connectionState(),
                joinState,
                peekInfo,
                e.remoteParticipants(),
                null,
                ring);
        boolean outgoingRing = outboundRingEnabled
                && ring == null
                && peekInfo.memberIds().isEmpty()
                && call.remoteParticipants().isEmpty()
                && !e.conversationTooBigToRing();
        return state.withCallAndActive(call,
                ActiveCallState.start(conversationId, e.hasLocalAudio(), e.hasLocalVideo(), outgoingRing));
    }

    private static CallingState startDirect(CallingState state, String conversationId, boolean audio, boolean video) {
        return state.withCallAndActive(
                DirectCall.prering(conversationId, false, video),
                ActiveCallState.start(conversationId, audio, video, true));
    }

    private static CallingState acceptCallPending(CallingState state, AcceptCallPending e) {
        if (state.getCall(e.conversationId()) == null) {
            log.warn("calling reducer: unable to accept a non-existent call, conversationId={}", e.conversationId());
            return state;
        }
        return state.withActiveCallState(ActiveCallState.start(e.conversationId(), true, e.asVideoCall(), false));
    }

    private static Transition endActiveCall(CallingState state, boolean hangUp) {
        CallRecord activeCall = state.getActiveCall();
        if (activeCall == null) {
            log.warn("calling reducer: no active call to remove");
            return Transition.of(state);
        }
        return switch (activeCall.callMode()) {
            case DIRECT -> Transition.of(state.withoutConversation(activeCall.conversationId()));
            // 群通话记录保留，后续 peek 会继续刷新成员快照
            case GROUP, ADHOC -> hangUp
                    ? Transition.of(state.withActiveCallState(null),
                    new CallingEffect.PeekAfterHangUp(activeCall.conversationId()))
                    : Transition.of(state.withActiveCallState(null));
        };
    }

    private static CallingState cancelRing(CallingState state, CancelRing e) {
        GroupCall call = state.getGroupCall(e.conversationId());
        if (call == null || call.ring() == null || call.ring().ringId() != e.ringId()) {
            log.debug("calling reducer: ring cancel ignored, conversationId={}, ringId={}", e.conversationId(), e.ringId());
            return state;
        }
        return state.withCall(call.withRing(null));
    }

    /**
     * 会话元数据变化：仅当前台群通话仍未加入、正准备外呼响铃、且会话刚变得“太大不能响铃”时关闭响铃。
     */
    private static CallingState conversationChanged(CallingState state, ConversationChanged e) {
        ActiveCallState active = state.getActiveCallState();
        if (active == null
                || !active.outgoingRing()
                || !active.conversationId().equals(e.conversationId())
                || !e.tooBigToRing()) {
            return state;
        }
        GroupCall call = state.getGroupCall(e.conversationId());
        if (call == null || call.joinState() != GroupCallJoinState.NOT_JOINED) {
            return state;
        }
        return state.withActiveCallState(active.withOutgoingRing(false));
    }

    private static CallingState removeConversation(CallingState state, String conversationId) {
        if (state.getCall(conversationId) == null && !state.isActive(conversationId)) {
            return state;
        }
        return state.withoutConversation(conversationId);
    }

    private static Transition incomingDirectCall(CallingState state, IncomingDirectCall e) {
        CallingState next = state.withCall(DirectCall.prering(e.conversationId(), true, e.videoCall()));
        if (state.isActive(e.conversationId())) {
            return Transition.of(next, new CallingEffect.StopCallingLobby(e.conversationId()));
        }
        return Transition.of(next);
    }

    private static CallingState incomingGroupCall(CallingState state, IncomingGroupCall e) {
        String conversationId = e.conversationId();
        CallRecord existing = state.getCall(conversationId);
        if (existing instanceof DirectCall) {
            log.warn("calling reducer: group ring for a conversation with a direct call, conversationId={}", conversationId);
            return state;
        }
        RingState ring = new RingState(e.ringId(), e.ringerId());
        if (existing instanceof GroupCall g) {
            if (g.ring() != null) {
                log.info("calling reducer: group call was already ringing, conversationId={}", conversationId);
                return state;
            }
            if (g.joinState() != GroupCallJoinState.NOT_JOINED) {
                log.info("calling reducer: got a ring for a call we're already in, conversationId={}", conversationId);
                return state;
            }
            return state.withCall(g.withRing(ring));
        }
        return state.withCall(GroupCall.notConnected(conversationId).withRing(ring));
    }

    private static CallingState callStateChange(CallingState state, CallStateChange e) {
        String conversationId = e.conversationId();
        // 需要授权的结束原因保留记录，用于展示授权界面
        if (e.callState() == CallState.ENDED
                && (e.callEndedReason() == null || !e.callEndedReason().keepsRecordAfterEnd())) {
            return removeConversation(state, conversationId);
        }

        DirectCall call = state.getDirectCall(conversationId);
        if (call == null) {
            log.warn("calling reducer: cannot update state for a non-direct call, conversationId={}", conversationId);
            return state;
        }

        ActiveCallState active = state.activeCallState();
        if (active != null && state.isActive(conversationId)) {
            active = active.withJoinedAt(e.acceptedTime());
        }
        return state.withCallAndActive(call.withCallState(e.callState(), e.callEndedReason()), active);
    }

    private static CallingState audioLevelsChange(CallingState state, AudioLevelsChange e) {
        ActiveCallState active = state.getActiveCallState();
        GroupCall call = state.getGroupCall(e.conversationId());

        // 画中画时用户看不到音量，直接跳过
        if (active == null || active.pip() || call == null) {
            return state;
        }

        double localAudioLevel = AudioLevels.truncate(e.localAudioLevel());
        Map<Integer, Double> remoteAudioLevels = new HashMap<>();
        if (e.remoteDeviceStates() != null) {
            for (RemoteDeviceAudioLevel device : e.remoteDeviceStates()) {
                if (device == null || device.audioLevel() == null) {
                    continue;
                }
                double graded = AudioLevels.truncate(device.audioLevel());
                if (graded > 0) {
                    remoteAudioLevels.put(device.demuxId(), graded);
                }
            }
        }

        // 高频事件：分档后无变化就不产生新状态
        if (active.localAudioLevel() == localAudioLevel
                && call.remoteAudioLevels() != null
                && call.remoteAudioLevels().equals(remoteAudioLevels)) {
            return state;
        }

        return state.withCallAndActive(call.withRemoteAudioLevels(remoteAudioLevels),
                active.withLocalAudioLevel(localAudioLevel));
    }

    private static CallingState groupCallStateChange(CallingState state, GroupCallStateChange e) {
        String conversationId = e.conversationId();
        CallRecord existingRecord = state.getCall(conversationId);
        if (existingRecord instanceof DirectCall) {
            log.warn("calling reducer: group state change for a direct call, conversationId={}", conversationId);
            return state;
        }
        GroupCall existing = (GroupCall) existingRecord;

        PeekInfo newPeekInfo = e.peekInfo();
        if (newPeekInfo == null) {
            newPeekInfo = existing != null && existing.peekInfo() != null
                    ? existing.peekInfo()
                    : PeekInfo.fromParticipants(e.remoteParticipants());
        }

        ActiveCallState newActive = state.activeCallState();
        if (state.isActive(conversationId)) {
            newActive = e.connectionState() == GroupCallConnectionState.NOT_CONNECTED
                    ? null
                    : newActive.withHasLocalAudio(e.hasLocalAudio()).withHasLocalVideo(e.hasLocalVideo());
        }

        // 有别人已在通话中：不再需要外呼响铃，且不会自动恢复
        if (newActive != null
                && newActive.outgoingRing()
                && newActive.conversationId().equals(conversationId)
                && newPeekInfo.isAnybodyElseIn(e.ourId())) {
            newActive = newActive.withOutgoingRing(false);
        }

        RingState ring = e.joinState() == GroupCallJoinState.NOT_JOINED && existing != null ? existing.ring() : null;

        GroupCall call = new GroupCall(
                conversationId,
                existing == null ? CallMode.GROUP : existing.callMode(),
                e.connectionState(),
                e.joinState(),
                newPeekInfo,
                e.remoteParticipants(),
                null,
                ring);
        return state.withCallAndActive(call, newActive);
    }

    /**
     * 只更新未连接的群通话：peek 发出后通话可能已连接，晚到的结果必须丢弃。
     */
    private static CallingState peekFulfilled(CallingState state, PeekFulfilled e) {
        String conversationId = e.conversationId();
        CallRecord existingRecord = state.getCall(conversationId);
        if (existingRecord instanceof DirectCall) {
            log.warn("calling reducer: peek result for a direct call, conversationId={}", conversationId);
            return state;
        }
        GroupCall existing = existingRecord == null
                ? GroupCall.notConnected(conversationId)
                : (GroupCall) existingRecord;

        if (existing.connectionState() != GroupCallConnectionState.NOT_CONNECTED) {
            log.debug("calling reducer: stale peek dropped, conversationId={}, connectionState={}",
                    conversationId, existing.connectionState());
            return state;
        }
        return state.withCall(existing.withPeekInfo(e.peekInfo()));
    }

    private static CallingState updateDirectCall(CallingState state, String conversationId, String what,
                                                 UnaryOperator<DirectCall> update) {
        DirectCall call = state.getDirectCall(conversationId);
        if (call == null) {
            log.warn("calling reducer: cannot update {} for a non-direct call, conversationId={}", what, conversationId);
            return state;
        }
        return state.withCall(update.apply(call));
    }

    private static CallingState updateActive(CallingState state, String what, UnaryOperator<ActiveCallState> update) {
        ActiveCallState active = state.getActiveCallState();
        if (active == null) {
            log.warn("calling reducer: cannot {} when there is no active call", what);
            return state;
        }
        ActiveCallState next = update.apply(active);
        return next == active ? state : state.withActiveCallState(next);
    }

    /**
     * 前台状态必须指向存在的记录；违反时（断言关闭的情况下）确定性地丢弃前台状态。
     */
    static CallingState enforceInvariants(CallingState state) {
        ActiveCallState active = state.activeCallState();
        if (active == null || state.getCall(active.conversationId()) != null) {
            return state;
        }
        String msg = "active call references missing conversation " + active.conversationId();
        assert false : msg;
        log.error("calling reducer: invariant violated, {}", msg);
        return state.withActiveCallState(null);
    }
}
