package com.strumbot.model;

/**
 * Lifecycle phase of a watched channel.
 */
public enum WatchPhase {
    OFFLINE,
    LIVE
}
