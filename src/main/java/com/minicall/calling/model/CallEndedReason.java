package com.minicall.calling.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CallEndedReason {

    LOCAL_HANGUP("local_hangup"),

    REMOTE_HANGUP("remote_hangup"),

    /**
     * 对端挂断且需要先接受消息请求。记录会被保留，用于展示“需要授权”界面。
     */
    REMOTE_HANGUP_NEED_PERMISSION("remote_hangup_need_permission"),

    DECLINED("declined"),

    BUSY("busy"),

    GLARE("glare"),

    RECEIVED_OFFER_EXPIRED("received_offer_expired"),

    RECEIVED_OFFER_WHILE_ACTIVE("received_offer_while_active"),

    SIGNALING_FAILURE("signaling_failure"),

    CONNECTION_FAILURE("connection_failure"),

    INTERNAL_FAILURE("internal_failure"),

    TIMEOUT("timeout"),

    ACCEPTED_ON_ANOTHER_DEVICE("accepted_on_another_device"),

    DECLINED_ON_ANOTHER_DEVICE("declined_on_another_device"),

    BUSY_ON_ANOTHER_DEVICE("busy_on_another_device");

    private final String desc;

    public boolean keepsRecordAfterEnd() {
        return this == REMOTE_HANGUP_NEED_PERMISSION;
    }
}
