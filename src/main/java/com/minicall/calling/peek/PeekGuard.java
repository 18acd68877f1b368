package com.minicall.calling.peek;

import com.minicall.calling.model.CallingState;
import com.minicall.calling.model.GroupCall;
import com.minicall.calling.model.GroupCallConnectionState;

public final class PeekGuard {

    private PeekGuard() {
    }

    /**
     * 已连接（或连接中、重连中）的群通话不需要 peek：成员信息由通话本身推送。
     */
    public static boolean shouldPeek(CallingState state, String conversationId) {
        GroupCall call = state == null ? null : state.getGroupCall(conversationId);
        return call == null || call.connectionState() == GroupCallConnectionState.NOT_CONNECTED;
    }
}
