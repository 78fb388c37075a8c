package com.stator.internal;

public enum RunnerState {
    RUNNING,
    DRAINING,
    STOPPED
}
