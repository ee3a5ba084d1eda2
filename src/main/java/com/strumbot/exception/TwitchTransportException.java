package com.strumbot.exception;

/**
 * Connection level failure talking to Twitch: DNS, connect, reset, timeout,
 * or a body that could not be decoded.
 */
public class TwitchTransportException extends StrumbotException {

    private final String route;

    public TwitchTransportException(String route, Throwable cause) {
        super(route + " > " + describe(cause), cause);
        this.route = route;
    }

    public String getRoute() {
        return route;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "transport failure";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank()
                ? cause.getClass().getSimpleName()
                : cause.getClass().getSimpleName() + ": " + message;
    }
}
