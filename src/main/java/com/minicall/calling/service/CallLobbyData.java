package com.minicall.calling.service;

import com.minicall.calling.model.CallMode;
import com.minicall.calling.model.GroupCallConnectionState;
import com.minicall.calling.model.GroupCallJoinState;
import com.minicall.calling.model.GroupCallParticipant;
import com.minicall.calling.model.PeekInfo;

import java.util.List;

/**
 * 大厅打开后底层返回的初始状态；单聊时群相关字段为空。
 */
public record CallLobbyData(
        CallMode callMode,
        boolean hasLocalAudio,
        boolean hasLocalVideo,
        GroupCallConnectionState connectionState,
        GroupCallJoinState joinState,
        PeekInfo peekInfo,
        List<GroupCallParticipant> remoteParticipants
) {

    public static CallLobbyData direct(boolean hasLocalAudio, boolean hasLocalVideo) {
        return new CallLobbyData(CallMode.DIRECT, hasLocalAudio, hasLocalVideo, null, null, null, List.of());
    }
}
