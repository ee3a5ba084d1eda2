package com.strumbot.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Settings for the stream watcher, bound from the {@code strumbot.*} namespace.
 * Validated on startup; an invalid configuration stops the application.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "strumbot")
public class StrumbotProperties {

    /**
     * Twitch logins to watch.
     */
    @NotEmpty
    private List<@NotBlank String> channels = new ArrayList<>();

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration pollInterval = Duration.ofSeconds(60);

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration initialDelay = Duration.ZERO;

    @Valid
    private final Twitch twitch = new Twitch();

    @Valid
    private final Thumbnail thumbnail = new Thumbnail();

    @Valid
    private final Pool pool = new Pool();

    @Valid
    private final Discord discord = new Discord();

    /**
     * Channel logins normalized to lower case, duplicates removed, order kept.
     */
    public List<String> getNormalizedChannels() {
        LinkedHashSet<String> logins = new LinkedHashSet<>();
        for (String channel : channels) {
            if (channel != null && !channel.isBlank()) {
                logins.add(channel.trim().toLowerCase(Locale.ROOT));
            }
        }
        return List.copyOf(logins);
    }

    public List<String> getChannels() {
        return channels;
    }

    public void setChannels(List<String> channels) {
        this.channels = channels;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }

    public Twitch getTwitch() {
        return twitch;
    }

    public Thumbnail getThumbnail() {
        return thumbnail;
    }

    public Pool getPool() {
        return pool;
    }

    public Discord getDiscord() {
        return discord;
    }

    public static class Twitch {

        @NotBlank
        private String clientId;

        /**
         * Static app access token. Refreshing it is left to the operator.
         */
        private String accessToken;

        @NotBlank
        private String baseUrl = "https://api.twitch.tv/helix";

        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration requestTimeout = Duration.ofSeconds(10);

        private boolean verifyOnStartup = true;

        @Min(1)
        private int maxAuthFailures = 5;

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getAccessToken() {
            return accessToken;
        }

        public void setAccessToken(String accessToken) {
            this.accessToken = accessToken;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public boolean isVerifyOnStartup() {
            return verifyOnStartup;
        }

        public void setVerifyOnStartup(boolean verifyOnStartup) {
            this.verifyOnStartup = verifyOnStartup;
        }

        public int getMaxAuthFailures() {
            return maxAuthFailures;
        }

        public void setMaxAuthFailures(int maxAuthFailures) {
            this.maxAuthFailures = maxAuthFailures;
        }
    }

    public static class Thumbnail {

        @Min(1)
        private int width = 1920;

        @Min(1)
        private int height = 1080;

        public int getWidth() {
            return width;
        }

        public void setWidth(int width) {
            this.width = width;
        }

        public int getHeight() {
            return height;
        }

        public void setHeight(int height) {
            this.height = height;
        }
    }

    public static class Pool {

        @Min(1)
        private int workerThreads = 4;

        @Min(1)
        private int queueCapacity = 100;

        @Min(1)
        private int metadataThreads = 4;

        @Min(1)
        private int thumbnailThreads = 2;

        @Min(1)
        private int webhookThreads = 2;

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getMetadataThreads() {
            return metadataThreads;
        }

        public void setMetadataThreads(int metadataThreads) {
            this.metadataThreads = metadataThreads;
        }

        public int getThumbnailThreads() {
            return thumbnailThreads;
        }

        public void setThumbnailThreads(int thumbnailThreads) {
            this.thumbnailThreads = thumbnailThreads;
        }

        public int getWebhookThreads() {
            return webhookThreads;
        }

        public void setWebhookThreads(int webhookThreads) {
            this.webhookThreads = webhookThreads;
        }
    }

    public static class Discord {

        /**
         * Incoming webhook URL. Notifications are only logged when unset or blank.
         */
        @Pattern(regexp = "^\\s*$|https?://\\S+", message = "must be an http(s) URL")
        private String webhookUrl;

        private String username = "Strumbot";

        private final Mentions mentions = new Mentions();

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public Mentions getMentions() {
            return mentions;
        }
    }

    /**
     * Optional text (usually a role mention) sent alongside each event type.
     */
    public static class Mentions {

        private String live;
        private String update;
        private String ended;

        public String getLive() {
            return live;
        }

        public void setLive(String live) {
            this.live = live;
        }

        public String getUpdate() {
            return update;
        }

        public void setUpdate(String update) {
            this.update = update;
        }

        public String getEnded() {
            return ended;
        }

        public void setEnded(String ended) {
            this.ended = ended;
        }
    }
}
