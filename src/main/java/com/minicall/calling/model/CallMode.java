package com.minicall.calling.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CallMode {

    DIRECT("direct"),

    GROUP("group"),

    /** 通过通话链接加入的多人通话，不绑定会话成员。 */
    ADHOC("adhoc");

    private final String desc;

    public boolean isMultiParty() {
        return this == GROUP || this == ADHOC;
    }
}
