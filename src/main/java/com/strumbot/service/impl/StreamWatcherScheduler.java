package com.strumbot.service.impl;

import com.strumbot.client.TwitchClient;
import com.strumbot.config.StrumbotProperties;
import com.strumbot.dto.WatcherStatus;
import com.strumbot.service.NotificationPublisher;
import com.strumbot.service.StreamNotificationFactory;
import com.strumbot.service.StreamWatchService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns one {@link StreamWatcher} per configured channel and fires their ticks from
 * a single shared timer.
 *
 * The timer thread only requests ticks; the ticks themselves run on the bounded
 * worker pool. Enabled by default, disable with strumbot.polling.enabled=false.
 */
@Service
@ConditionalOnProperty(name = "strumbot.polling.enabled", havingValue = "true", matchIfMissing = true)
public class StreamWatcherScheduler implements StreamWatchService {

    private static final Logger logger = LoggerFactory.getLogger(StreamWatcherScheduler.class);

    private final List<StreamWatcher> watchers;
    private final TaskScheduler timer;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration initialDelay;

    private volatile ScheduledFuture<?> schedule;

    @Autowired
    public StreamWatcherScheduler(
            StrumbotProperties properties,
            TwitchClient twitchClient,
            NotificationPublisher publisher,
            StreamNotificationFactory notificationFactory,
            MeterRegistry meterRegistry,
            ApplicationEventPublisher eventPublisher,
            @Qualifier("watcherExecutor") Executor watcherExecutor,
            @Qualifier("watcherTimer") TaskScheduler watcherTimer,
            Clock clock) {
        this(createWatchers(properties, twitchClient, publisher, notificationFactory,
                        meterRegistry, eventPublisher, watcherExecutor, clock),
                watcherTimer,
                clock,
                properties.getPollInterval(),
                properties.getInitialDelay());
    }

    /**
     * Constructor for testing with prebuilt watchers.
     */
    StreamWatcherScheduler(List<StreamWatcher> watchers, TaskScheduler timer, Clock clock,
                           Duration pollInterval, Duration initialDelay) {
        this.watchers = Collections.unmodifiableList(new ArrayList<>(watchers));
        this.timer = timer;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.initialDelay = initialDelay;
    }

    private static List<StreamWatcher> createWatchers(
            StrumbotProperties properties,
            TwitchClient twitchClient,
            NotificationPublisher publisher,
            StreamNotificationFactory notificationFactory,
            MeterRegistry meterRegistry,
            ApplicationEventPublisher eventPublisher,
            Executor executor,
            Clock clock) {
        List<StreamWatcher> watchers = new ArrayList<>();
        for (String login : properties.getNormalizedChannels()) {
            watchers.add(new StreamWatcher(
                    login,
                    twitchClient,
                    publisher,
                    notificationFactory,
                    meterRegistry,
                    eventPublisher,
                    executor,
                    clock,
                    properties.getThumbnail().getWidth(),
                    properties.getThumbnail().getHeight(),
                    properties.getTwitch().getMaxAuthFailures()));
        }
        return watchers;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (schedule != null) {
            return;
        }
        logger.info("Watching {} channel(s) every {}s, first poll in {}s",
                watchers.size(), pollInterval.toSeconds(), initialDelay.toSeconds());
        schedule = timer.scheduleAtFixedRate(this::tickAll, clock.instant().plus(initialDelay), pollInterval);
    }

    @PreDestroy
    public synchronized void stop() {
        if (schedule != null) {
            schedule.cancel(false);
            schedule = null;
            logger.info("Stopped watching {} channel(s)", watchers.size());
        }
    }

    /**
     * One timer fire. Never throws, so a failing channel cannot cancel the schedule.
     */
    void tickAll() {
        for (StreamWatcher watcher : watchers) {
            try {
                watcher.requestTick();
            } catch (RuntimeException e) {
                logger.error("Failed to request tick for {}", watcher.getLogin(), e);
            }
        }
    }

    @Override
    public List<WatcherStatus> getStatuses() {
        return watchers.stream()
                .map(StreamWatcher::getStatus)
                .toList();
    }

    @Override
    public Optional<WatcherStatus> getStatus(String login) {
        if (login == null) {
            return Optional.empty();
        }
        String normalized = login.trim().toLowerCase(Locale.ROOT);
        return watchers.stream()
                .filter(watcher -> watcher.getLogin().equals(normalized))
                .map(StreamWatcher::getStatus)
                .findFirst();
    }

    @Override
    public int pollAll() {
        logger.info("Manual poll requested for {} channel(s)", watchers.size());
        tickAll();
        return watchers.size();
    }

    @Override
    public Duration getPollInterval() {
        return pollInterval;
    }

    boolean isRunning() {
        return schedule != null;
    }
}
