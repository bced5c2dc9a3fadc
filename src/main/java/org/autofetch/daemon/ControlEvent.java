package org.autofetch.daemon;

public enum ControlEvent {
    RELOAD_REQUESTED,
    SHUTDOWN_REQUESTED
}
