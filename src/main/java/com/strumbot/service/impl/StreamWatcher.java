package com.strumbot.service.impl;

import com.strumbot.client.TwitchClient;
import com.strumbot.dto.NotificationMessage;
import com.strumbot.dto.WatcherStatus;
import com.strumbot.exception.TwitchApiException;
import com.strumbot.listener.TwitchCredentialsRejectedEvent;
import com.strumbot.model.Game;
import com.strumbot.model.PollOutcome;
import com.strumbot.model.Stream;
import com.strumbot.model.StreamEvent;
import com.strumbot.model.WatchState;
import com.strumbot.service.NotificationPublisher;
import com.strumbot.service.StreamNotificationFactory;
import com.strumbot.util.FutureUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lifecycle state machine for one channel.
 *
 * Each tick polls the channel, reconciles the result against the remembered
 * {@link WatchState} and publishes notifications for detected transitions:
 * <ul>
 *   <li>offline to live: "went live" with game name and thumbnail</li>
 *   <li>live to offline: "ended" with the session summary</li>
 *   <li>live with a different start timestamp: "ended" for the old session, then
 *       "went live" for the new one</li>
 *   <li>live with a different game: "game changed"</li>
 * </ul>
 *
 * Ticks of one watcher are chained: a tick starts only after the previous tick,
 * including its notifications, has completed. That chain is the only writer of the
 * watch state. A failed poll never changes the state.
 */
public class StreamWatcher {

    private static final Logger logger = LoggerFactory.getLogger(StreamWatcher.class);

    private final WatchState state;
    private final TwitchClient twitchClient;
    private final NotificationPublisher publisher;
    private final StreamNotificationFactory notificationFactory;
    private final MeterRegistry meterRegistry;
    private final ApplicationEventPublisher eventPublisher;
    private final Executor executor;
    private final Clock clock;
    private final int thumbnailWidth;
    private final int thumbnailHeight;
    private final int maxAuthFailures;

    // Tail of this channel's tick chain
    private final AtomicReference<CompletableFuture<PollOutcome>> tail =
            new AtomicReference<>(CompletableFuture.completedFuture(PollOutcome.UNCHANGED));
    // Tick waiting behind the running one, null when none is waiting
    private final AtomicReference<CompletableFuture<PollOutcome>> queued = new AtomicReference<>();

    private volatile WatcherStatus status;

    public StreamWatcher(String login,
                         TwitchClient twitchClient,
                         NotificationPublisher publisher,
                         StreamNotificationFactory notificationFactory,
                         MeterRegistry meterRegistry,
                         ApplicationEventPublisher eventPublisher,
                         Executor executor,
                         Clock clock,
                         int thumbnailWidth,
                         int thumbnailHeight,
                         int maxAuthFailures) {
        this.state = new WatchState(login);
        this.twitchClient = twitchClient;
        this.publisher = publisher;
        this.notificationFactory = notificationFactory;
        this.meterRegistry = meterRegistry;
        this.eventPublisher = eventPublisher;
        this.executor = executor;
        this.clock = clock;
        this.thumbnailWidth = thumbnailWidth;
        this.thumbnailHeight = thumbnailHeight;
        this.maxAuthFailures = maxAuthFailures;
        this.status = WatcherStatus.initial(login);
    }

    public String getLogin() {
        return state.getLogin();
    }

    /**
     * Latest snapshot, safe to read from any thread.
     */
    public WatcherStatus getStatus() {
        return status;
    }

    /**
     * Queue a tick behind the current one.
     *
     * At most one tick waits while another runs; further requests in that window
     * are coalesced into the waiting tick.
     *
     * @return future of the tick that will serve this request
     */
    public CompletableFuture<PollOutcome> requestTick() {
        CompletableFuture<PollOutcome> next = new CompletableFuture<>();
        CompletableFuture<PollOutcome> waiting = queued.compareAndExchange(null, next);
        if (waiting != null) {
            logger.debug("Tick for {} already queued, coalescing", getLogin());
            meterRegistry.counter("strumbot_poll_coalesced_total", "channel", getLogin()).increment();
            return waiting;
        }

        CompletableFuture<PollOutcome> previous = tail.getAndSet(next);
        previous.whenComplete((ignored, error) -> {
            try {
                executor.execute(() -> {
                    queued.compareAndSet(next, null);
                    runTick().whenComplete((outcome, tickError) ->
                            next.complete(tickError == null ? outcome : PollOutcome.FAILED));
                });
            } catch (RejectedExecutionException e) {
                logger.warn("Tick for {} rejected by worker pool: {}", getLogin(), e.getMessage());
                queued.compareAndSet(next, null);
                next.complete(PollOutcome.FAILED);
            }
        });
        return next;
    }

    /**
     * One tick that never completes exceptionally.
     */
    private CompletableFuture<PollOutcome> runTick() {
        try {
            return poll().exceptionally(error -> {
                logger.error("Unexpected error while polling {}", getLogin(), FutureUtils.unwrap(error));
                return PollOutcome.FAILED;
            });
        } catch (RuntimeException e) {
            logger.error("Unexpected error while polling {}", getLogin(), e);
            return CompletableFuture.completedFuture(PollOutcome.FAILED);
        }
    }

    /**
     * Run the transition algorithm once. Must only be called from the tick chain,
     * or from tests that drive ticks one at a time.
     */
    CompletableFuture<PollOutcome> poll() {
        Timer.Sample timer = Timer.start(meterRegistry);

        CompletableFuture<Optional<Stream>> lookup;
        try {
            lookup = twitchClient.getStreamByLogin(getLogin());
        } catch (RuntimeException e) {
            lookup = CompletableFuture.failedFuture(e);
        }

        return lookup
                .handle((result, error) -> error == null ? reconcile(result) : onPollFailure(error))
                .thenCompose(stage -> stage)
                .whenComplete((outcome, error) -> {
                    String tag = error == null ? outcome.getTag() : PollOutcome.FAILED.getTag();
                    timer.stop(meterRegistry.timer("strumbot_poll_duration", "channel", getLogin()));
                    meterRegistry.counter("strumbot_poll_total", "channel", getLogin(), "outcome", tag).increment();
                    status = WatcherStatus.of(state);
                });
    }

    WatchState getState() {
        return state;
    }

    private CompletableFuture<PollOutcome> reconcile(Optional<Stream> result) {
        Instant now = clock.instant();
        state.recordSuccess(now);

        if (result.isEmpty()) {
            if (!state.isLive()) {
                logger.debug("{} is still offline", getLogin());
                return CompletableFuture.completedFuture(PollOutcome.UNCHANGED);
            }
            Stream previous = state.getLastStream();
            String previousGameId = state.getGameId();
            state.enterOffline();
            logger.info("{} went offline (session started {})", getLogin(), previous.startedAt());
            return announceEnded(previous, previousGameId, now)
                    .thenApply(ignored -> PollOutcome.ENDED);
        }

        Stream stream = result.get();

        if (!state.isLive()) {
            state.enterLive(stream);
            logger.info("{} went live (session started {}, game {})", getLogin(), stream.startedAt(), stream.gameId());
            return announceLive(stream, now)
                    .thenApply(ignored -> PollOutcome.WENT_LIVE);
        }

        if (!state.isSameSession(stream)) {
            // The previous session ended and a new one started between two polls
            Stream previous = state.getLastStream();
            String previousGameId = state.getGameId();
            state.enterLive(stream);
            logger.info("{} restarted: session {} replaced by {}", getLogin(), previous.startedAt(), stream.startedAt());
            return announceEnded(previous, previousGameId, now)
                    .thenCompose(ignored -> announceLive(stream, now))
                    .thenApply(ignored -> PollOutcome.RESTARTED);
        }

        if (!state.isSameGame(stream)) {
            String previousGameId = state.getGameId();
            state.refresh(stream);
            logger.info("{} switched game {} -> {}", getLogin(), previousGameId, stream.gameId());
            return announceGameChange(stream, previousGameId, now)
                    .thenApply(ignored -> PollOutcome.GAME_CHANGED);
        }

        state.refresh(stream);
        logger.debug("{} is still live, nothing changed", getLogin());
        return CompletableFuture.completedFuture(PollOutcome.UNCHANGED);
    }

    private CompletableFuture<PollOutcome> onPollFailure(Throwable error) {
        Throwable cause = FutureUtils.unwrap(error);
        boolean credentialsRejected = cause instanceof TwitchApiException
                && ((TwitchApiException) cause).isCredentialsRejected();

        int authFailures = state.recordFailure(clock.instant(), credentialsRejected);
        logger.warn("Failed to poll {} ({} consecutive failures), keeping state {}: {}",
                getLogin(), state.getConsecutiveFailures(), state.getPhase(), cause.getMessage());

        if (credentialsRejected && authFailures == maxAuthFailures) {
            int statusCode = ((TwitchApiException) cause).getStatus();
            logger.error("Twitch rejected credentials {} times in a row while polling {}", authFailures, getLogin());
            eventPublisher.publishEvent(new TwitchCredentialsRejectedEvent(this, getLogin(), authFailures, statusCode));
        }
        return CompletableFuture.completedFuture(PollOutcome.FAILED);
    }

    private CompletableFuture<Void> announceLive(Stream stream, Instant now) {
        CompletableFuture<String> gameName = resolveGameName(stream.gameId());
        CompletableFuture<byte[]> thumbnail = fetchThumbnail(stream);
        return gameName
                .thenCombine(thumbnail, (name, image) -> notificationFactory.wentLive(stream, name, image, now))
                .thenCompose(message -> deliver(StreamEvent.WENT_LIVE, message));
    }

    private CompletableFuture<Void> announceGameChange(Stream stream, String previousGameId, Instant now) {
        CompletableFuture<String> oldName = resolveGameName(previousGameId);
        CompletableFuture<String> newName = resolveGameName(stream.gameId());
        return oldName
                .thenCombine(newName, (before, after) -> notificationFactory.gameChanged(stream, before, after, now))
                .thenCompose(message -> deliver(StreamEvent.GAME_CHANGED, message));
    }

    private CompletableFuture<Void> announceEnded(Stream previous, String gameId, Instant now) {
        return resolveGameName(gameId)
                .thenApply(name -> notificationFactory.ended(previous, name, now))
                .thenCompose(message -> deliver(StreamEvent.ENDED, message));
    }

    /**
     * Best effort: null when the id is empty, unknown, or the lookup fails.
     */
    private CompletableFuture<String> resolveGameName(String gameId) {
        if (gameId == null || gameId.isBlank()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Optional<Game>> lookup;
        try {
            lookup = twitchClient.getGame(gameId);
        } catch (RuntimeException e) {
            lookup = CompletableFuture.failedFuture(e);
        }
        return lookup
                .thenApply(game -> game.map(Game::name).orElse(null))
                .exceptionally(error -> {
                    logger.warn("Failed to resolve game {} for {}: {}",
                            gameId, getLogin(), FutureUtils.unwrap(error).getMessage());
                    return null;
                });
    }

    /**
     * Best effort: null when the download fails.
     */
    private CompletableFuture<byte[]> fetchThumbnail(Stream stream) {
        CompletableFuture<byte[]> download;
        try {
            download = twitchClient.getThumbnail(stream, thumbnailWidth, thumbnailHeight);
        } catch (RuntimeException e) {
            download = CompletableFuture.failedFuture(e);
        }
        return download.exceptionally(error -> {
            logger.warn("Failed to fetch thumbnail for {}: {}", getLogin(), FutureUtils.unwrap(error).getMessage());
            return null;
        });
    }

    /**
     * Single delivery attempt. The returned future never fails.
     */
    private CompletableFuture<Void> deliver(StreamEvent event, NotificationMessage message) {
        CompletableFuture<Void> delivery;
        try {
            delivery = publisher.publish(message);
        } catch (RuntimeException e) {
            delivery = CompletableFuture.failedFuture(e);
        }
        return delivery.handle((ignored, error) -> {
            if (error != null) {
                logger.error("Failed to deliver {} notification for {} via {}",
                        event, getLogin(), publisher.getChannelName(), FutureUtils.unwrap(error));
                meterRegistry.counter("strumbot_notifications_total",
                        "event", event.getTag(), "status", "error").increment();
            } else {
                logger.info("Delivered {} notification for {}", event, getLogin());
                meterRegistry.counter("strumbot_notifications_total",
                        "event", event.getTag(), "status", "success").increment();
            }
            return null;
        });
    }
}
