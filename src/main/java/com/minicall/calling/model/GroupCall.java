package com.minicall.calling.model;

import java.util.List;
import java.util.Map;

/**
 * 群（或通话链接）通话记录。
 *
 * <ul>
 *   <li>{@code peekInfo}：首次 peek 前可能为 null</li>
 *   <li>{@code remoteAudioLevels}：demuxId -> 分档后的音量，仅活跃通话会写入；null 表示从未写入</li>
 *   <li>{@code ring}：未被加入消化的响铃；一旦 joinState 离开 NOT_JOINED 就清空</li>
 * </ul>
 */
public record GroupCall(
        String conversationId,
        CallMode callMode,
        GroupCallConnectionState connectionState,
        GroupCallJoinState joinState,
        PeekInfo peekInfo,
        List<GroupCallParticipant> remoteParticipants,
        Map<Integer, Double> remoteAudioLevels,
        RingState ring
) implements CallRecord {

    public GroupCall {
        callMode = callMode == null ? CallMode.GROUP : callMode;
        remoteParticipants = remoteParticipants == null ? List.of() : List.copyOf(remoteParticipants);
        remoteAudioLevels = remoteAudioLevels == null ? null : Map.copyOf(remoteAudioLevels);
    }

    /**
     * 未连接、未加入、空快照的默认记录（peek 结果或响铃先于任何状态到达时使用）。
     */
    public static GroupCall notConnected(String conversationId) {
        return new GroupCall(conversationId, CallMode.GROUP, GroupCallConnectionState.NOT_CONNECTED,
                GroupCallJoinState.NOT_JOINED, PeekInfo.empty(), List.of(), null, null);
    }

    public boolean isRinging() {
        return ring != null;
    }

    public GroupCall withPeekInfo(PeekInfo value) {
        return new GroupCall(conversationId, callMode, connectionState, joinState, value, remoteParticipants,
                remoteAudioLevels, ring);
    }

    public GroupCall withRing(RingState value) {
        return new GroupCall(conversationId, callMode, connectionState, joinState, peekInfo, remoteParticipants,
                remoteAudioLevels, value);
    }

    public GroupCall withRemoteAudioLevels(Map<Integer, Double> value) {
        return new GroupCall(conversationId, callMode, connectionState, joinState, peekInfo, remoteParticipants,
                value, ring);
    }
}
