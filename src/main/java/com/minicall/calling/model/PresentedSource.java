package com.minicall.calling.model;

/**
 * 正在共享的屏幕/窗口。
 */
public record PresentedSource(String id, String name) {
}
