package com.minicall.calling.model;

import lombok.With;

import java.util.Set;

/**
 * 前台通话（大厅/响铃中/已连接）的本地状态，全进程最多一个。
 *
 * <p>{@code conversationId} 必须始终指向 {@link CallingState#callsByConversation()} 中存在的记录。</p>
 */
@With
public record ActiveCallState(
        String conversationId,
        boolean hasLocalAudio,
        boolean hasLocalVideo,
        double localAudioLevel,
        CallViewMode viewMode,
        Long joinedAt,
        boolean outgoingRing,
        boolean pip,
        PresentedSource presentingSource,
        Set<String> safetyNumberChangedMemberIds,
        boolean settingsDialogOpen,
        boolean showParticipantsList
) {

    public ActiveCallState {
        viewMode = viewMode == null ? CallViewMode.GRID : viewMode;
        safetyNumberChangedMemberIds = safetyNumberChangedMemberIds == null
                ? Set.of()
                : Set.copyOf(safetyNumberChangedMemberIds);
    }

    public static ActiveCallState start(String conversationId, boolean hasLocalAudio, boolean hasLocalVideo,
                                        boolean outgoingRing) {
        return new ActiveCallState(conversationId, hasLocalAudio, hasLocalVideo, 0, CallViewMode.GRID, null,
                outgoingRing, false, null, Set.of(), false, false);
    }
}
