package com.minicall.calling.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 单聊通话状态。记录上的 {@code null} 表示“尚未开始”（仅大厅阶段）。
 */
@Getter
@RequiredArgsConstructor
public enum CallState {

    PRERING("prering"),

    RINGING("ringing"),

    ACCEPTED("accepted"),

    ENDED("ended");

    private final String desc;
}
