package com.strumbot.model;

/**
 * Lifecycle events that produce a notification.
 */
public enum StreamEvent {
    WENT_LIVE("went_live"),
    GAME_CHANGED("game_changed"),
    ENDED("ended");

    private final String tag;

    StreamEvent(String tag) {
        this.tag = tag;
    }

    /**
     * Value used as a metric tag.
     */
    public String getTag() {
        return tag;
    }
}
