package com.minicall.calling.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 群通话成员快照（peek 结果）。
 *
 * <p>每次 peek 成功后整体替换，不做字段级合并。</p>
 *
 * @param memberIds   当前在通话中的成员 id
 * @param creatorId   发起者，可能未知
 * @param eraId       通话轮次 id，可能未知
 * @param maxDevices  设备上限；{@link #UNLIMITED_DEVICES} 表示未知/不限
 * @param deviceCount 当前设备数（可能与远端参与者列表长度不一致）
 */
public record PeekInfo(
        List<String> memberIds,
        String creatorId,
        String eraId,
        int maxDevices,
        int deviceCount
) {

    public static final int UNLIMITED_DEVICES = Integer.MAX_VALUE;

    public PeekInfo {
        memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
        deviceCount = Math.max(0, deviceCount);
    }

    public static PeekInfo empty() {
        return new PeekInfo(List.of(), null, null, UNLIMITED_DEVICES, 0);
    }

    /**
     * 尚未拿到 peek 结果时，用远端参与者列表临时拼一个快照。
     */
    public static PeekInfo fromParticipants(List<GroupCallParticipant> participants) {
        List<GroupCallParticipant> list = participants == null ? List.of() : participants;
        List<String> ids = new ArrayList<>(list.size());
        for (GroupCallParticipant p : list) {
            ids.add(p.memberId());
        }
        return new PeekInfo(ids, null, null, UNLIMITED_DEVICES, list.size());
    }

    public boolean isAnybodyElseIn(String ourId) {
        for (String id : memberIds) {
            if (!Objects.equals(id, ourId)) {
                return true;
            }
        }
        return false;
    }
}
