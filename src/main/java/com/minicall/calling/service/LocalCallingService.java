package com.minicall.calling.service;

import com.minicall.calling.conversation.ConversationDirectory;
import com.minicall.calling.model.CallMode;
import com.minicall.calling.model.GroupCallConnectionState;
import com.minicall.calling.model.GroupCallJoinState;
import com.minicall.calling.model.PeekInfo;
import com.minicall.calling.model.PresentedSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 未接入真实媒体层时使用的默认实现：所有操作立即成功，只打日志。
 *
 * <p>peek 返回 null（没有快照），大厅直接按会话类型给出初始状态。</p>
 */
@Slf4j
@RequiredArgsConstructor
public class LocalCallingService implements CallingService {

    private final ConversationDirectory conversations;

    @Override
    public CompletableFuture<PeekInfo> peekGroupCall(String conversationId) {
        log.debug("local calling: peek conversationId={}", conversationId);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> joinGroupCall(String conversationId, boolean hasLocalAudio, boolean hasLocalVideo,
                                                 boolean shouldRing) {
        log.info("local calling: join group call conversationId={}, audio={}, video={}, ring={}",
                conversationId, hasLocalAudio, hasLocalVideo, shouldRing);
        return done();
    }

    @Override
    public CompletableFuture<Void> acceptDirectCall(String conversationId, boolean asVideoCall) {
        log.info("local calling: accept direct call conversationId={}, video={}", conversationId, asVideoCall);
        return done();
    }

    @Override
    public CompletableFuture<Void> declineDirectCall(String conversationId) {
        log.info("local calling: decline direct call conversationId={}", conversationId);
        return done();
    }

    @Override
    public CompletableFuture<Void> declineGroupCall(String conversationId, long ringId) {
        log.info("local calling: decline group call conversationId={}, ringId={}", conversationId, ringId);
        return done();
    }

    @Override
    public CompletableFuture<Void> hangup(String conversationId, String reason) {
        log.info("local calling: hang up conversationId={}, reason={}", conversationId, reason);
        return done();
    }

    @Override
    public CompletableFuture<Void> startOutgoingDirectCall(String conversationId, boolean hasLocalAudio,
                                                           boolean hasLocalVideo) {
        log.info("local calling: start direct call conversationId={}, audio={}, video={}",
                conversationId, hasLocalAudio, hasLocalVideo);
        return done();
    }

    @Override
    public CompletableFuture<CallLobbyData> startCallingLobby(String conversationId, boolean hasLocalAudio,
                                                              boolean hasLocalVideo) {
        CallMode mode = conversations.getCallMode(conversationId);
        if (mode == null) {
            log.warn("local calling: lobby for unknown conversation, conversationId={}", conversationId);
            return CompletableFuture.completedFuture(null);
        }
        if (mode == CallMode.DIRECT) {
            return CompletableFuture.completedFuture(CallLobbyData.direct(hasLocalAudio, hasLocalVideo));
        }
        return CompletableFuture.completedFuture(new CallLobbyData(mode, hasLocalAudio, hasLocalVideo,
                GroupCallConnectionState.NOT_CONNECTED, GroupCallJoinState.NOT_JOINED, null, List.of()));
    }

    @Override
    public void stopCallingLobby(String conversationId) {
        log.info("local calling: stop lobby conversationId={}", conversationId);
    }

    @Override
    public CompletableFuture<Void> setOutgoingAudio(String conversationId, boolean enabled) {
        log.debug("local calling: outgoing audio conversationId={}, enabled={}", conversationId, enabled);
        return done();
    }

    @Override
    public CompletableFuture<Void> setOutgoingVideo(String conversationId, boolean enabled) {
        log.debug("local calling: outgoing video conversationId={}, enabled={}", conversationId, enabled);
        return done();
    }

    @Override
    public void enableLocalCamera() {
        log.debug("local calling: enable local camera");
    }

    @Override
    public void disableLocalVideo() {
        log.debug("local calling: disable local video");
    }

    @Override
    public CompletableFuture<Void> setPresenting(String conversationId, boolean hasLocalVideo, PresentedSource source) {
        log.info("local calling: presenting conversationId={}, source={}", conversationId,
                source == null ? null : source.id());
        return done();
    }

    @Override
    public CompletableFuture<Void> setGroupCallVideoRequest(String conversationId, List<VideoRequest> requests,
                                                            int speakerHeight) {
        log.debug("local calling: video request conversationId={}, requests={}, speakerHeight={}",
                conversationId, requests == null ? 0 : requests.size(), speakerHeight);
        return done();
    }

    @Override
    public void resendGroupCallMediaKeys(String conversationId) {
        log.info("local calling: resend media keys conversationId={}", conversationId);
    }

    @Override
    public CompletableFuture<Void> updateCallHistoryForGroupCall(String conversationId, GroupCallJoinState joinState,
                                                                 PeekInfo peekInfo) {
        log.debug("local calling: call history conversationId={}, joinState={}, devices={}",
                conversationId, joinState, peekInfo == null ? 0 : peekInfo.deviceCount());
        return done();
    }

    private static CompletableFuture<Void> done() {
        return CompletableFuture.completedFuture(null);
    }
}
