package com.minicall.calling.command;

import com.minicall.calling.model.CallMode;

public record StartCallRequest(
        String conversationId,
        CallMode callMode,
        boolean hasLocalAudio,
        boolean hasLocalVideo
) {
}
