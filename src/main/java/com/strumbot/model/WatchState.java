package com.strumbot.model;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Per-channel lifecycle state.
 *
 * Owned by exactly one watcher and only mutated from that watcher's tick chain,
 * so it carries no synchronization of its own.
 */
public class WatchState {

    private final String login;

    private WatchPhase phase = WatchPhase.OFFLINE;
    private Stream lastStream;
    private OffsetDateTime startedAt;
    private String gameId;

    // Bookkeeping for status reporting only
    private Instant lastPollAt;
    private Instant lastSuccessAt;
    private int consecutiveFailures;
    private int consecutiveAuthFailures;

    public WatchState(String login) {
        this.login = login;
    }

    /**
     * Remember a freshly started session.
     */
    public void enterLive(Stream stream) {
        this.phase = WatchPhase.LIVE;
        this.lastStream = stream;
        this.startedAt = stream.startedAt();
        this.gameId = stream.gameId();
    }

    /**
     * Forget the current session.
     */
    public void enterOffline() {
        this.phase = WatchPhase.OFFLINE;
        this.lastStream = null;
        this.startedAt = null;
        this.gameId = null;
    }

    /**
     * Same session, possibly with a new game or title.
     */
    public void refresh(Stream stream) {
        this.lastStream = stream;
        this.gameId = stream.gameId();
    }

    public boolean isLive() {
        return phase == WatchPhase.LIVE;
    }

    public boolean isSameSession(Stream stream) {
        return startedAt != null && startedAt.isEqual(stream.startedAt());
    }

    public boolean isSameGame(Stream stream) {
        return gameId == null ? stream.gameId() == null : gameId.equals(stream.gameId());
    }

    public void recordSuccess(Instant now) {
        this.lastPollAt = now;
        this.lastSuccessAt = now;
        this.consecutiveFailures = 0;
        this.consecutiveAuthFailures = 0;
    }

    /**
     * @return the number of consecutive credential rejections after this failure
     */
    public int recordFailure(Instant now, boolean credentialsRejected) {
        this.lastPollAt = now;
        this.consecutiveFailures++;
        if (credentialsRejected) {
            this.consecutiveAuthFailures++;
        } else {
            this.consecutiveAuthFailures = 0;
        }
        return consecutiveAuthFailures;
    }

    public String getLogin() {
        return login;
    }

    public WatchPhase getPhase() {
        return phase;
    }

    public Stream getLastStream() {
        return lastStream;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public String getGameId() {
        return gameId;
    }

    public Instant getLastPollAt() {
        return lastPollAt;
    }

    public Instant getLastSuccessAt() {
        return lastSuccessAt;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public int getConsecutiveAuthFailures() {
        return consecutiveAuthFailures;
    }

    @Override
    public String toString() {
        return "WatchState{" +
                "login='" + login + '\'' +
                ", phase=" + phase +
                ", startedAt=" + startedAt +
                ", gameId='" + gameId + '\'' +
                ", consecutiveFailures=" + consecutiveFailures +
                '}';
    }
}
