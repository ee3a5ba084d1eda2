package com.strumbot.config;

import com.strumbot.dto.WatcherStatus;
import com.strumbot.model.WatchPhase;
import com.strumbot.service.StreamWatchService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Health of the channel watchers, reported as the "watchers" component.
 * A channel is stale when its last successful poll is older than three poll
 * intervals. Channels that have not polled yet are not stale, channels that never
 * succeeded become stale after three consecutive failures.
 */
@Component("watchers")
public class WatchersHealthIndicator implements HealthIndicator {

    static final int STALE_AFTER_INTERVALS = 3;

    private final Optional<StreamWatchService> watchService;
    private final Clock clock;

    @Autowired
    public WatchersHealthIndicator(Optional<StreamWatchService> watchService, Clock clock) {
        this.watchService = watchService;
        this.clock = clock;
    }

    @Override
    public Health health() {
        if (watchService.isEmpty()) {
            return Health.unknown()
                    .withDetail("polling", "disabled")
                    .build();
        }

        StreamWatchService service = watchService.get();
        Duration staleAfter = service.getPollInterval().multipliedBy(STALE_AFTER_INTERVALS);
        Instant now = clock.instant();

        List<WatcherStatus> statuses = service.getStatuses();
        List<String> stale = new ArrayList<>();
        int live = 0;
        for (WatcherStatus status : statuses) {
            if (status.phase() == WatchPhase.LIVE) {
                live++;
            }
            if (isStale(status, now, staleAfter)) {
                stale.add(status.login());
            }
        }

        Health.Builder builder = stale.isEmpty() ? Health.up() : Health.down();
        builder.withDetail("channels", statuses.size())
                .withDetail("live", live);
        if (!stale.isEmpty()) {
            builder.withDetail("stale", stale)
                    .withDetail("staleAfterSeconds", staleAfter.toSeconds());
        }
        return builder.build();
    }

    private static boolean isStale(WatcherStatus status, Instant now, Duration staleAfter) {
        if (status.lastPollAt() == null) {
            return false;
        }
        if (status.lastSuccessAt() == null) {
            // Polled but never succeeded
            return status.consecutiveFailures() >= STALE_AFTER_INTERVALS;
        }
        return status.lastSuccessAt().isBefore(now.minus(staleAfter));
    }
}
