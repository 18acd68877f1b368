package com.minicall.calling.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DirectCall(
        String conversationId,
        CallState callState,
        CallEndedReason callEndedReason,
        boolean incoming,
        boolean videoCall,
        boolean hasRemoteVideo,
        boolean sharingScreen
) implements CallRecord {

    public static DirectCall lobby(String conversationId, boolean videoCall) {
        return new DirectCall(conversationId, null, null, false, videoCall, false, false);
    }

    public static DirectCall prering(String conversationId, boolean incoming, boolean videoCall) {
        return new DirectCall(conversationId, CallState.PRERING, null, incoming, videoCall, false, false);
    }

    @Override
    @JsonProperty("callMode")
    public CallMode callMode() {
        return CallMode.DIRECT;
    }

    public DirectCall withCallState(CallState state, CallEndedReason reason) {
        return new DirectCall(conversationId, state, reason, incoming, videoCall, hasRemoteVideo, sharingScreen);
    }

    public DirectCall withRemoteVideo(boolean hasVideo) {
        return new DirectCall(conversationId, callState, callEndedReason, incoming, videoCall, hasVideo, sharingScreen);
    }

    public DirectCall withSharingScreen(boolean sharing) {
        return new DirectCall(conversationId, callState, callEndedReason, incoming, videoCall, hasRemoteVideo, sharing);
    }
}
