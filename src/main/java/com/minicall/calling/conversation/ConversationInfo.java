package com.minicall.calling.conversation;

import com.minicall.calling.model.CallMode;

/**
 * 通话核心关心的会话元数据。
 *
 * @param callMode          会话上的通话类型（单聊 DIRECT，群 GROUP）
 * @param memberCount       会话成员数
 * @param announcementsOnly 仅管理员可发言的群
 * @param weAreAdmin        本端是否为管理员
 */
public record ConversationInfo(
        String conversationId,
        CallMode callMode,
        int memberCount,
        boolean announcementsOnly,
        boolean weAreAdmin
) {
}
