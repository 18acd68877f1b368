package com.minicall.calling.service;

/**
 * 向某个远端设备请求的视频分辨率。
 */
public record VideoRequest(int demuxId, int width, int height) {
}
