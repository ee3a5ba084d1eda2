package com.strumbot.listener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;

/**
 * Shuts the application down when Twitch keeps rejecting the credentials.
 * Polling with a revoked token would otherwise fail silently forever.
 */
@Component
public class CredentialsRejectedListener {

    private static final Logger logger = LoggerFactory.getLogger(CredentialsRejectedListener.class);

    static final int EXIT_CODE = 2;

    private final ApplicationContext context;
    private final IntConsumer exit;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    @Autowired
    public CredentialsRejectedListener(ApplicationContext context) {
        this(context, System::exit);
    }

    CredentialsRejectedListener(ApplicationContext context, IntConsumer exit) {
        this.context = context;
        this.exit = exit;
    }

    @EventListener
    public void onCredentialsRejected(TwitchCredentialsRejectedEvent event) {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        logger.error("Twitch rejected credentials {} times in a row (HTTP {}, channel {}), shutting down",
                event.getConsecutiveFailures(), event.getStatus(), event.getLogin());

        // Closing the context waits for the worker pool, which may be running this tick
        Thread shutdown = new Thread(() -> {
            int code = SpringApplication.exit(context, () -> EXIT_CODE);
            exit.accept(code);
        }, "strumbot-shutdown");
        shutdown.start();
    }
}
