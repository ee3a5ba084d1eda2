package com.strumbot.dto;

import com.strumbot.model.WatchPhase;
import com.strumbot.model.WatchState;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Read-only view of a watcher, published at the end of every tick for health and
 * status reporting.
 */
public record WatcherStatus(
        String login,
        WatchPhase phase,
        OffsetDateTime startedAt,
        String gameId,
        String title,
        Instant lastPollAt,
        Instant lastSuccessAt,
        int consecutiveFailures
) {

    public static WatcherStatus initial(String login) {
        return new WatcherStatus(login, WatchPhase.OFFLINE, null, null, null, null, null, 0);
    }

    public static WatcherStatus of(WatchState state) {
        return new WatcherStatus(
                state.getLogin(),
                state.getPhase(),
                state.getStartedAt(),
                state.getGameId(),
                state.getLastStream() != null ? state.getLastStream().title() : null,
                state.getLastPollAt(),
                state.getLastSuccessAt(),
                state.getConsecutiveFailures()
        );
    }
}
