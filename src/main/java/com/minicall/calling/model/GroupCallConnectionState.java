package com.minicall.calling.model;

public enum GroupCallConnectionState {
    NOT_CONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING
}
