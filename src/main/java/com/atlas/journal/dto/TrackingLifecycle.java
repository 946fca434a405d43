package com.atlas.journal.dto;

/** Lifecycle states of a tracking session. */
public enum TrackingLifecycle {
    STOPPED,
    ACTIVE,
    PAUSED
}
