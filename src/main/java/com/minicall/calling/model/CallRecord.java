package com.minicall.calling.model;

/**
 * 会话上的通话记录：{@link DirectCall} 或 {@link GroupCall}，每个会话最多一条。
 *
 * <p>调用方按 {@link #callMode()} 分支处理；假定了具体类型的操作在类型不符时必须显式 no-op。</p>
 */
public interface CallRecord {

    String conversationId();

    CallMode callMode();
}
