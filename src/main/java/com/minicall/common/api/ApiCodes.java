package com.minicall.common.api;

/**
 * 统一错误码定义。
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 */
    public static final int BAD_REQUEST = 40000;

    /** 路径不存在 */
    public static final int NOT_FOUND = 40400;

    /** 与当前通话状态冲突（没有前台通话、通话已存在等） */
    public static final int CONFLICT = 40900;

    /** 服务端未预期异常 */
    public static final int INTERNAL_ERROR = 50000;
}
