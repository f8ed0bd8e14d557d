package com.touchline.domain.enums;

public enum TeamSide {
    HOME,
    AWAY;

    public TeamSide opponent() {
        return this == HOME ? AWAY : HOME;
    }
}
