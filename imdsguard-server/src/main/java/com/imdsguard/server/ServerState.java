package com.imdsguard.server;

/** Lifecycle of a {@link MetadataServer}. Transitions only move forward. */
public enum ServerState {
    /** Constructed, not serving. */
    IDLE,
    /** {@code serve()} called, application context starting. */
    STARTING,
    /** Socket bound and accepting. */
    RUNNING,
    /** Shutdown initiated; in-flight requests are finishing. */
    DRAINING,
    /** Terminal. */
    STOPPED
}
