package com.strumbot.model;

import java.time.OffsetDateTime;

/**
 * Snapshot of a live broadcast as returned by one poll.
 * A new instance is produced on every successful poll; instances are never updated.
 *
 * @param login        channel login the stream belongs to
 * @param userName     display name of the broadcaster (may be null)
 * @param gameId       category id, empty when the broadcaster cleared it
 * @param title        stream title
 * @param type         "live" for a regular broadcast, other values such as "rerun" otherwise
 * @param thumbnailUrl preview URL template containing {width} and {height} placeholders
 * @param startedAt    start of the session, used as the session identity
 * @param viewerCount  viewers at the time of the poll
 */
public record Stream(
        String login,
        String userName,
        String gameId,
        String title,
        String type,
        String thumbnailUrl,
        OffsetDateTime startedAt,
        int viewerCount
) {

    public static final String TYPE_LIVE = "live";

    public boolean isRerun() {
        return type != null && !type.isEmpty() && !TYPE_LIVE.equals(type);
    }

    /**
     * Name to show in notifications, falling back to the login.
     */
    public String displayName() {
        return userName != null && !userName.isBlank() ? userName : login;
    }

    /**
     * Resolve the thumbnail template for the requested size.
     */
    public String thumbnailUrl(int width, int height) {
        return thumbnailUrl
                .replace("{width}", Integer.toString(width))
                .replace("{height}", Integer.toString(height));
    }
}
