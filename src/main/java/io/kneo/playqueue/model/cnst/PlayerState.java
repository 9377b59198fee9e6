package io.kneo.playqueue.model.cnst;

public enum PlayerState {
    STOP,
    PLAY,
    PAUSE
}
