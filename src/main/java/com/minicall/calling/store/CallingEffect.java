package com.minicall.calling.store;

/**
 * 状态迁移产生的副作用意图，由命令层在迁移提交后执行；reducer 本身不做任何 IO。
 */
public interface CallingEffect {

    /** 群通话挂断后，等断开完成再刷新一次成员快照。 */
    record PeekAfterHangUp(String conversationId) implements CallingEffect {
    }

    /** 收到同一会话的来电时，关闭本地大厅。 */
    record StopCallingLobby(String conversationId) implements CallingEffect {
    }
}
