package com.strumbot.exception;

/**
 * Thrown when the Twitch API answers with a non-success status.
 * Keeps the route, status code and the API's own explanation so callers can log
 * or act on them.
 */
public class TwitchApiException extends StrumbotException {

    private final String route;
    private final int status;
    private final String reason;

    public TwitchApiException(String route, int status, String reason) {
        super(route + " > " + status + ": " + reason);
        this.route = route;
        this.status = status;
        this.reason = reason;
    }

    public String getRoute() {
        return route;
    }

    public int getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }

    /**
     * True when the API refused the configured client id or token.
     */
    public boolean isCredentialsRejected() {
        return status == 401 || status == 403;
    }
}
