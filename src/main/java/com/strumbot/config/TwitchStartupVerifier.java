package com.strumbot.config;

import com.strumbot.client.TwitchClient;
import com.strumbot.exception.TwitchApiException;
import com.strumbot.exception.TwitchTransportException;
import com.strumbot.util.FutureUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Checks the Twitch credentials once before polling starts.
 *
 * Rejected credentials or an unreachable API abort startup. Any other API error is
 * logged and left to the regular polls.
 */
@Component
@ConditionalOnProperty(name = "strumbot.twitch.verify-on-startup", havingValue = "true", matchIfMissing = true)
public class TwitchStartupVerifier implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(TwitchStartupVerifier.class);

    private final TwitchClient twitchClient;
    private final List<String> channels;
    private final Duration timeout;

    @Autowired
    public TwitchStartupVerifier(TwitchClient twitchClient, StrumbotProperties properties) {
        this(twitchClient, properties.getNormalizedChannels(), properties.getTwitch().getRequestTimeout());
    }

    TwitchStartupVerifier(TwitchClient twitchClient, List<String> channels, Duration timeout) {
        this.twitchClient = twitchClient;
        this.channels = channels;
        this.timeout = timeout;
    }

    @Override
    public void run(ApplicationArguments args) {
        verify();
    }

    void verify() {
        if (channels.isEmpty()) {
            return;
        }
        String login = channels.get(0);
        logger.info("Verifying Twitch credentials by looking up {}", login);

        try {
            twitchClient.getStreamByLogin(login).get(timeout.toMillis() * 2, TimeUnit.MILLISECONDS);
            logger.info("Twitch credentials accepted");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while verifying Twitch credentials", e);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Twitch API did not answer within " + timeout.toSeconds() * 2 + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = FutureUtils.unwrap(e);
            if (cause instanceof TwitchApiException apiException) {
                if (apiException.isCredentialsRejected()) {
                    throw new IllegalStateException("Twitch rejected the configured credentials: "
                            + apiException.getMessage(), apiException);
                }
                logger.warn("Twitch credential check returned an error, continuing: {}", apiException.getMessage());
                return;
            }
            if (cause instanceof TwitchTransportException) {
                throw new IllegalStateException("Twitch API is unreachable: " + cause.getMessage(), cause);
            }
            throw new IllegalStateException("Twitch credential check failed", cause);
        }
    }
}
