package com.strumbot.service;

import com.strumbot.dto.WatcherStatus;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Periodically watches the configured channels.
 */
public interface StreamWatchService {

    /**
     * Status of every watched channel, in configuration order.
     */
    List<WatcherStatus> getStatuses();

    Optional<WatcherStatus> getStatus(String login);

    /**
     * Request an immediate tick for every channel, outside the regular schedule.
     * Requests for channels that already have a tick waiting are coalesced.
     *
     * @return number of channels a tick was requested for
     */
    int pollAll();

    Duration getPollInterval();
}
