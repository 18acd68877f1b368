package com.minicall.calling.command;

import lombok.Getter;

/**
 * 命令的前置条件不满足（与当前通话状态冲突）。{@code reason} 为 snake_case 原因码，直接返回给调用方。
 */
@Getter
public class CallingException extends RuntimeException {

    private final String reason;

    public CallingException(String reason) {
        super(reason);
        this.reason = reason;
    }
}
