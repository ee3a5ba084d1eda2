package com.strumbot.service;

import com.strumbot.config.StrumbotProperties;
import com.strumbot.dto.NotificationMessage;
import com.strumbot.model.Stream;
import com.strumbot.util.StreamDurationFormatter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Builds the notification for each stream lifecycle event.
 * Centralizes wording so every publisher renders the same text.
 */
@Component
public class StreamNotificationFactory {

    public static final String UNKNOWN_GAME = "Unknown game";
    public static final String UNTITLED = "Untitled";
    public static final String THUMBNAIL_FILE_NAME = "thumbnail.jpg";

    public static final int LIVE_COLOR = 0x6441A5;
    public static final int UPDATE_COLOR = 0x1F8B4C;
    public static final int ENDED_COLOR = 0x99AAB5;

    private final StrumbotProperties.Mentions mentions;

    @Autowired
    public StreamNotificationFactory(StrumbotProperties properties) {
        this(properties.getDiscord().getMentions());
    }

    StreamNotificationFactory(StrumbotProperties.Mentions mentions) {
        this.mentions = mentions;
    }

    /**
     * Notification for a channel that just went live.
     *
     * @param stream    the new session
     * @param gameName  resolved game name, null when the lookup failed
     * @param thumbnail preview image, null when the download failed
     */
    public NotificationMessage wentLive(Stream stream, String gameName, byte[] thumbnail, Instant now) {
        String title = stream.isRerun()
                ? String.format("%s started a rerun", stream.displayName())
                : String.format("%s is live!", stream.displayName());

        NotificationMessage.NotificationMessageBuilder builder = NotificationMessage.builder()
                .content(blankToNull(mentions.getLive()))
                .title(title)
                .description(titleOrDefault(stream.title()))
                .url(channelUrl(stream.login()))
                .color(LIVE_COLOR)
                .field(new NotificationMessage.Field("Playing", gameOrDefault(gameName), true))
                .timestamp(now);

        if (thumbnail != null && thumbnail.length > 0) {
            builder.imageBytes(thumbnail).imageFileName(THUMBNAIL_FILE_NAME);
        }
        return builder.build();
    }

    /**
     * Notification for a category switch within the same session.
     */
    public NotificationMessage gameChanged(Stream stream, String oldGameName, String newGameName, Instant now) {
        return NotificationMessage.builder()
                .content(blankToNull(mentions.getUpdate()))
                .title(String.format("%s switched game", stream.displayName()))
                .description(String.format("%s → %s", gameOrDefault(oldGameName), gameOrDefault(newGameName)))
                .url(channelUrl(stream.login()))
                .color(UPDATE_COLOR)
                .field(new NotificationMessage.Field("Title", titleOrDefault(stream.title()), false))
                .timestamp(now)
                .build();
    }

    /**
     * Summary of a finished session.
     *
     * @param stream   last stream seen during the session
     * @param gameName game at the end of the session, null when unknown
     * @param now      time the end was observed
     */
    public NotificationMessage ended(Stream stream, String gameName, Instant now) {
        Duration duration = Duration.between(stream.startedAt().toInstant(), now);
        return NotificationMessage.builder()
                .content(blankToNull(mentions.getEnded()))
                .title(String.format("%s ended the stream", stream.displayName()))
                .url(channelUrl(stream.login()))
                .color(ENDED_COLOR)
                .field(new NotificationMessage.Field("Game", gameOrDefault(gameName), true))
                .field(new NotificationMessage.Field("Title", titleOrDefault(stream.title()), false))
                .field(new NotificationMessage.Field("Duration", StreamDurationFormatter.format(duration), true))
                .timestamp(now)
                .build();
    }

    public static String channelUrl(String login) {
        return "https://twitch.tv/" + login;
    }

    private static String gameOrDefault(String gameName) {
        return gameName != null && !gameName.isBlank() ? gameName : UNKNOWN_GAME;
    }

    private static String titleOrDefault(String title) {
        return title != null && !title.isBlank() ? title : UNTITLED;
    }

    private static String blankToNull(String value) {
        return value != null && !value.isBlank() ? value : null;
    }
}
