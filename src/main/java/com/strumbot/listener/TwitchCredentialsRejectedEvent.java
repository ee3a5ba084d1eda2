package com.strumbot.listener;

import org.springframework.context.ApplicationEvent;

/**
 * Published when Twitch keeps rejecting the configured credentials for a channel.
 */
public class TwitchCredentialsRejectedEvent extends ApplicationEvent {

    private final String login;
    private final int consecutiveFailures;
    private final int status;

    public TwitchCredentialsRejectedEvent(Object source, String login, int consecutiveFailures, int status) {
        super(source);
        this.login = login;
        this.consecutiveFailures = consecutiveFailures;
        this.status = status;
    }

    public String getLogin() {
        return login;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public int getStatus() {
        return status;
    }
}
