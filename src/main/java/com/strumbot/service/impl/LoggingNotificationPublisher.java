package com.strumbot.service.impl;

import com.strumbot.dto.NotificationMessage;
import com.strumbot.service.NotificationPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Used when no webhook is configured: notifications only go to the log.
 */
public class LoggingNotificationPublisher implements NotificationPublisher {

    private static final Logger logger = LoggerFactory.getLogger(LoggingNotificationPublisher.class);

    @Override
    public CompletableFuture<Void> publish(NotificationMessage message) {
        logger.info("Webhook not configured - notification '{}': {} (fields={}, image={})",
                message.getTitle(),
                message.getDescription(),
                message.getFields(),
                message.hasImage() ? message.getImageBytes().length + " bytes" : "none");
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public String getChannelName() {
        return "log";
    }
}
