package com.minicall.calling.command;

import com.minicall.calling.conversation.ConversationDirectory;
import com.minicall.calling.conversation.ConversationInfo;
import com.minicall.calling.model.ActiveCallState;
import com.minicall.calling.model.CallMode;
import com.minicall.calling.model.CallRecord;
import com.minicall.calling.model.CallingState;
import com.minicall.calling.model.DirectCall;
import com.minicall.calling.model.GroupCall;
import com.minicall.calling.model.PresentedSource;
import com.minicall.calling.service.CallLobbyData;
import com.minicall.calling.service.CallingService;
import com.minicall.calling.service.VideoRequest;
import com.minicall.calling.store.CallSessionStore;
import com.minicall.calling.store.CallingEvent;
import com.minicall.config.CallingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 用户侧通话命令：校验当前状态 -> 调用底层能力 -> 成功后提交状态迁移。
 *
 * <p>错误约定：</p>
 * <ul>
 *   <li>前置条件不满足：同步抛 {@link CallingException}</li>
 *   <li>底层能力失败：返回的 future 异常完成，状态不迁移</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallingCommandService {

    /** 群通话设备数达到该值时，进入大厅默认静音。 */
    private static final int MAX_DEVICES_FOR_UNMUTED_LOBBY = 8;

    private final CallSessionStore store;
    private final CallingService callingService;
    private final ConversationDirectory conversations;
    private final CallingEffectRunner effects;
    private final CallingProperties props;

    public CallingState getState() {
        return store.getState();
    }

    public CompletableFuture<Void> acceptCall(String conversationId, boolean asVideoCall) {
        CallRecord call = requireCall(conversationId, "accept");
        CompletableFuture<Void> f = call.callMode() == CallMode.DIRECT
                ? callingService.acceptDirectCall(conversationId, asVideoCall)
                : callingService.joinGroupCall(conversationId, true, asVideoCall, false);
        return f.thenRun(() -> dispatch(new CallingEvent.AcceptCallPending(conversationId, asVideoCall)));
    }

    public CompletableFuture<Void> declineCall(String conversationId) {
        CallRecord call = requireCall(conversationId, "decline");
        if (call instanceof GroupCall g) {
            if (g.ring() == null) {
                log.error("calling command: decline a group call without a ring id, conversationId={}", conversationId);
                throw new CallingException("missing_ring_id");
            }
            long ringId = g.ring().ringId();
            return callingService.declineGroupCall(conversationId, ringId)
                    .thenRun(() -> dispatch(new CallingEvent.CancelRing(conversationId, ringId)));
        }
        return callingService.declineDirectCall(conversationId)
                .thenRun(() -> dispatch(new CallingEvent.DeclineDirectCall(conversationId)));
    }

    /**
     * 挂断前台通话；没有前台通话时什么也不做。群通话挂断后会延迟刷新一次成员快照。
     */
    public CompletableFuture<Void> hangUpActiveCall(String reason) {
        CallRecord active = store.getState().getActiveCall();
        if (active == null) {
            log.debug("calling command: hang up without an active call");
            return CompletableFuture.completedFuture(null);
        }
        String conversationId = active.conversationId();
        return callingService.hangup(conversationId, reason).thenRun(() -> {
            if (!store.getState().isActive(conversationId)) {
                log.debug("calling command: active call changed during hang up, conversationId={}", conversationId);
                return;
            }
            dispatch(new CallingEvent.HangUp());
        });
    }

    public void cancelCall(String conversationId) {
        callingService.stopCallingLobby(conversationId);
        dispatch(new CallingEvent.CancelCall());
    }

    public void closeNeedPermissionScreen() {
        dispatch(new CallingEvent.CloseNeedPermissionScreen());
    }

    /**
     * 打开通话大厅。会话必须已知，且当前没有前台通话。
     *
     * <p>底层返回 null（无法进入大厅）时不迁移状态。</p>
     */
    public CompletableFuture<Void> startCallingLobby(String conversationId, boolean isVideoCall) {
        ConversationInfo conversation = requireConversation(conversationId);
        CallingState state = store.getState();
        if (state.getActiveCallState() != null) {
            throw new CallingException("call_already_active");
        }

        // 单聊的设备数按 0 计
        GroupCall groupCall = state.getGroupCall(conversationId);
        int deviceCount = 0;
        if (groupCall != null) {
            deviceCount = groupCall.peekInfo() != null && groupCall.peekInfo().deviceCount() > 0
                    ? groupCall.peekInfo().deviceCount()
                    : groupCall.remoteParticipants().size();
        }
        boolean tooBigToRing = conversations.isTooBigToRing(conversation);

        return callingService.startCallingLobby(conversationId, deviceCount < MAX_DEVICES_FOR_UNMUTED_LOBBY, isVideoCall)
                .thenAccept(lobby -> {
                    if (lobby == null) {
                        log.info("calling command: lobby not available, conversationId={}", conversationId);
                        return;
                    }
                    dispatch(toStartLobby(conversationId, lobby, tooBigToRing));
                });
    }

    /**
     * 会话页发起通话：仅管理员可发言的群，只有在已有人通话时普通成员才能加入；语音通话只支持单聊。
     */
    public CompletableFuture<Void> startOutgoingCall(String conversationId, boolean isVideoCall) {
        ConversationInfo conversation = requireConversation(conversationId);
        if (!isVideoCall && conversation.callMode() != CallMode.DIRECT) {
            throw new CallingException("audio_call_requires_direct_conversation");
        }
        if (conversation.announcementsOnly() && !conversation.weAreAdmin()) {
            GroupCall call = store.getState().getGroupCall(conversationId);
            boolean ongoing = call != null
                    && call.callMode() == CallMode.GROUP
                    && call.peekInfo() != null
                    && call.peekInfo().isAnybodyElseIn(props.ourIdEffective());
            if (!ongoing) {
                throw new CallingException("cannot_start_group_call");
            }
        }
        log.info("calling command: starting outgoing call, conversationId={}, video={}", conversationId, isVideoCall);
        return startCallingLobby(conversationId, isVideoCall);
    }

    /**
     * 单聊：拨出后进入 Prering；群通话：加入，后续状态由 group state change 驱动。
     */
    public CompletableFuture<Void> startCall(StartCallRequest request) {
        if (request == null || request.conversationId() == null || request.callMode() == null) {
            throw new IllegalArgumentException("invalid_start_call_request");
        }
        String conversationId = request.conversationId();
        if (request.callMode() == CallMode.DIRECT) {
            return callingService.startOutgoingDirectCall(conversationId, request.hasLocalAudio(), request.hasLocalVideo())
                    .thenRun(() -> dispatch(new CallingEvent.StartDirectCall(
                            conversationId, request.hasLocalAudio(), request.hasLocalVideo())));
        }

        boolean shouldRing = false;
        ActiveCallState active = store.getState().getActiveCallState();
        if (props.outboundRingEnabledEffective() && active != null && active.outgoingRing()) {
            ConversationInfo conversation = conversations.get(active.conversationId());
            shouldRing = conversation != null && !conversations.isTooBigToRing(conversation);
        }
        return callingService.joinGroupCall(conversationId, request.hasLocalAudio(), request.hasLocalVideo(), shouldRing);
    }

    public CompletableFuture<Void> setLocalAudio(boolean enabled) {
        CallRecord active = requireActiveCall("set local audio");
        return callingService.setOutgoingAudio(active.conversationId(), enabled)
                .thenRun(() -> dispatch(new CallingEvent.SetLocalAudio(enabled)));
    }

    /**
     * 单聊在真正拨出前只开关本地摄像头预览。
     */
    public CompletableFuture<Void> setLocalVideo(boolean enabled) {
        CallRecord active = requireActiveCall("set local video");
        CompletableFuture<Void> f;
        if (!(active instanceof DirectCall direct) || direct.callState() != null) {
            f = callingService.setOutgoingVideo(active.conversationId(), enabled);
        } else {
            if (enabled) {
                callingService.enableLocalCamera();
            } else {
                callingService.disableLocalVideo();
            }
            f = CompletableFuture.completedFuture(null);
        }
        return f.thenRun(() -> dispatch(new CallingEvent.SetLocalVideo(enabled)));
    }

    /**
     * @param source 要共享的来源；null 表示停止共享
     */
    public CompletableFuture<Void> setPresenting(PresentedSource source) {
        CallRecord active = requireActiveCall("present");
        ActiveCallState activeState = store.getState().getActiveCallState();
        boolean hasLocalVideo = activeState != null && activeState.hasLocalVideo();
        return callingService.setPresenting(active.conversationId(), hasLocalVideo, source)
                .thenRun(() -> dispatch(new CallingEvent.SetPresenting(source)));
    }

    public CompletableFuture<Void> setGroupCallVideoRequest(String conversationId, List<VideoRequest> requests,
                                                            int speakerHeight) {
        return callingService.setGroupCallVideoRequest(conversationId,
                requests == null ? List.of() : requests, speakerHeight);
    }

    public void setOutgoingRing(boolean outgoingRing) {
        dispatch(new CallingEvent.SetOutgoingRing(outgoingRing));
    }

    /**
     * 用户确认了安全码变化：重新下发媒体密钥并清除不信任标记。
     */
    public void keyChangeOk(String conversationId) {
        callingService.resendGroupCallMediaKeys(conversationId);
        dispatch(new CallingEvent.MarkCallTrusted());
    }

    public void returnToActiveCall() {
        dispatch(new CallingEvent.ReturnToActiveCall());
    }

    public void togglePip() {
        dispatch(new CallingEvent.TogglePip());
    }

    public void toggleSettings() {
        dispatch(new CallingEvent.ToggleSettings());
    }

    public void toggleParticipants() {
        dispatch(new CallingEvent.ToggleParticipants());
    }

    public void toggleSpeakerView() {
        dispatch(new CallingEvent.ToggleSpeakerView());
    }

    public void switchToPresentationView() {
        dispatch(new CallingEvent.SwitchToPresentationView());
    }

    public void switchFromPresentationView() {
        dispatch(new CallingEvent.SwitchFromPresentationView());
    }

    private void dispatch(CallingEvent event) {
        effects.run(store.dispatch(event));
    }

    private CallRecord requireCall(String conversationId, String action) {
        CallRecord call = store.getState().getCall(conversationId);
        if (call == null) {
            log.error("calling command: trying to {} a non-existent call, conversationId={}", action, conversationId);
            throw new CallingException("call_not_found");
        }
        return call;
    }

    private CallRecord requireActiveCall(String action) {
        CallRecord active = store.getState().getActiveCall();
        if (active == null) {
            log.warn("calling command: trying to {} when no call is active", action);
            throw new CallingException("no_active_call");
        }
        return active;
    }

    private ConversationInfo requireConversation(String conversationId) {
        ConversationInfo conversation = conversations.get(conversationId);
        if (conversation == null) {
            throw new CallingException("conversation_not_found");
        }
        return conversation;
    }

    private static CallingEvent.StartLobby toStartLobby(String conversationId, CallLobbyData lobby,
                                                        boolean tooBigToRing) {
        if (lobby.callMode() == null || lobby.callMode() == CallMode.DIRECT) {
            return CallingEvent.StartLobby.direct(conversationId, lobby.hasLocalAudio(), lobby.hasLocalVideo());
        }
        return new CallingEvent.StartLobby(
                conversationId,
                lobby.callMode(),
                lobby.hasLocalAudio(),
                lobby.hasLocalVideo(),
                lobby.connectionState(),
                lobby.joinState(),
                lobby.peekInfo(),
                lobby.remoteParticipants(),
                tooBigToRing);
    }
}
