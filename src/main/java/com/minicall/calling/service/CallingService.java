package com.minicall.calling.service;

import com.minicall.calling.model.GroupCallJoinState;
import com.minicall.calling.model.PeekInfo;
import com.minicall.calling.model.PresentedSource;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 通话底层能力（信令、媒体传输、编解码）的抽象。
 *
 * <p>返回 future 的方法都是挂起点：future 正常完成是状态机推进对应迁移的唯一依据；
 * 异常完成时状态机不推进。</p>
 */
public interface CallingService {

    /**
     * 查询群通话当前成员快照。没有可用结果时以 null 完成；传输失败时异常完成。
     */
    CompletableFuture<PeekInfo> peekGroupCall(String conversationId);

    CompletableFuture<Void> joinGroupCall(String conversationId, boolean hasLocalAudio, boolean hasLocalVideo,
                                          boolean shouldRing);

    CompletableFuture<Void> acceptDirectCall(String conversationId, boolean asVideoCall);

    CompletableFuture<Void> declineDirectCall(String conversationId);

    CompletableFuture<Void> declineGroupCall(String conversationId, long ringId);

    CompletableFuture<Void> hangup(String conversationId, String reason);

    CompletableFuture<Void> startOutgoingDirectCall(String conversationId, boolean hasLocalAudio, boolean hasLocalVideo);

    /**
     * 打开本地大厅（预览、预连接）。无法进入大厅时以 null 完成。
     */
    CompletableFuture<CallLobbyData> startCallingLobby(String conversationId, boolean hasLocalAudio,
                                                       boolean hasLocalVideo);

    void stopCallingLobby(String conversationId);

    CompletableFuture<Void> setOutgoingAudio(String conversationId, boolean enabled);

    CompletableFuture<Void> setOutgoingVideo(String conversationId, boolean enabled);

    /** 通话尚未开始时只开关本地摄像头预览。 */
    void enableLocalCamera();

    void disableLocalVideo();

    CompletableFuture<Void> setPresenting(String conversationId, boolean hasLocalVideo, PresentedSource source);

    CompletableFuture<Void> setGroupCallVideoRequest(String conversationId, List<VideoRequest> requests,
                                                     int speakerHeight);

    void resendGroupCallMediaKeys(String conversationId);

    /**
     * peek 成功后更新通话记录（fire-and-forget，结果不回读）。
     *
     * @param joinState 本端加入状态；没有群通话记录时为 null
     */
    CompletableFuture<Void> updateCallHistoryForGroupCall(String conversationId, GroupCallJoinState joinState,
                                                          PeekInfo peekInfo);
}
