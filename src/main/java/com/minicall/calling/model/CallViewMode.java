package com.minicall.calling.model;

public enum CallViewMode {
    GRID,
    SPEAKER,
    PRESENTATION
}
