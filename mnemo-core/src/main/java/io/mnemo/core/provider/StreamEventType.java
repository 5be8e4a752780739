package io.mnemo.core.provider;

public enum StreamEventType {
    START,
    DELTA,
    STOP,
    ERROR
}
