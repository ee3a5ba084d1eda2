package com.strumbot.model;

/**
 * Result of a single watcher tick.
 */
public enum PollOutcome {
    /** Nothing changed, no notification. */
    UNCHANGED,
    WENT_LIVE,
    GAME_CHANGED,
    ENDED,
    /** A new session was observed while the previous one was still remembered as live. */
    RESTARTED,
    /** The stream lookup failed; state was left untouched. */
    FAILED;

    public String getTag() {
        return name().toLowerCase();
    }
}
