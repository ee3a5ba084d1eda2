package com.strumbot.service;

import com.strumbot.dto.NotificationMessage;

import java.util.concurrent.CompletableFuture;

/**
 * Destination for stream notifications.
 *
 * Submission is fire-and-forget for callers: the returned future only reports the
 * outcome and fails with {@link com.strumbot.exception.NotificationDeliveryException}.
 * Implementations make a single delivery attempt.
 */
public interface NotificationPublisher {

    CompletableFuture<Void> publish(NotificationMessage message);

    /**
     * Name used in logs and metric tags.
     */
    String getChannelName();
}
