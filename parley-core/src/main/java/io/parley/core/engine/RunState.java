package io.parley.core.engine;

public enum RunState {
    IDLE,
    RUNNING,
    COMPLETE
}
