package com.minicall.calling.model;

public record GroupCallParticipant(
        String memberId,
        int demuxId,
        boolean hasRemoteAudio,
        boolean hasRemoteVideo,
        boolean presenting,
        boolean sharingScreen,
        Long speakerTime,
        double videoAspectRatio
) {
}
