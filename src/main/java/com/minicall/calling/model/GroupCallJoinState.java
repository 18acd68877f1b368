package com.minicall.calling.model;

public enum GroupCallJoinState {
    NOT_JOINED,
    JOINING,
    JOINED
}
