package udem.fieldauthors.collection;

public enum RunState {
    PRELOADING,
    RUNNING,
    DRAINING,
    STOPPED
}
