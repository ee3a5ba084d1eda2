package com.strumbot.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strumbot.config.StrumbotProperties;
import com.strumbot.dto.twitch.HelixError;
import com.strumbot.dto.twitch.HelixGame;
import com.strumbot.dto.twitch.HelixResponse;
import com.strumbot.dto.twitch.HelixStream;
import com.strumbot.exception.TwitchApiException;
import com.strumbot.exception.TwitchTransportException;
import com.strumbot.model.Game;
import com.strumbot.model.Stream;
import com.strumbot.util.FutureUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Async client for the Twitch Helix API.
 *
 * Every call is independent and stateless; nothing is retried here. Metadata
 * lookups and thumbnail downloads run on separate HTTP clients so a slow image
 * download cannot hold up stream polling.
 *
 * Returned futures fail with {@link TwitchApiException} for non-2xx responses and
 * with {@link TwitchTransportException} for connection problems and timeouts.
 */
@Component
public class TwitchClient {

    private static final Logger logger = LoggerFactory.getLogger(TwitchClient.class);

    private static final String USER_AGENT = "Strumbot/1.0";
    public static final int DEFAULT_THUMBNAIL_WIDTH = 1920;
    public static final int DEFAULT_THUMBNAIL_HEIGHT = 1080;

    private static final TypeReference<HelixResponse<HelixStream>> STREAMS_TYPE = new TypeReference<>() {};
    private static final TypeReference<HelixResponse<HelixGame>> GAMES_TYPE = new TypeReference<>() {};

    private final HttpClient apiClient;
    private final HttpClient thumbnailClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String clientId;
    private final String accessToken;
    private final Duration requestTimeout;

    @Autowired
    public TwitchClient(
            @Qualifier("twitchApiHttpClient") HttpClient apiClient,
            @Qualifier("twitchThumbnailHttpClient") HttpClient thumbnailClient,
            ObjectMapper objectMapper,
            StrumbotProperties properties) {
        this(apiClient,
                thumbnailClient,
                objectMapper,
                properties.getTwitch().getBaseUrl(),
                properties.getTwitch().getClientId(),
                properties.getTwitch().getAccessToken(),
                properties.getTwitch().getRequestTimeout());
    }

    /**
     * Constructor for testing with custom HttpClients.
     */
    TwitchClient(HttpClient apiClient, HttpClient thumbnailClient, ObjectMapper objectMapper,
                 String baseUrl, String clientId, String accessToken, Duration requestTimeout) {
        this.apiClient = apiClient;
        this.thumbnailClient = thumbnailClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.clientId = clientId;
        this.accessToken = accessToken;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Look up the current broadcast of a channel.
     *
     * @param login channel login, case-insensitive
     * @return the stream, or empty when the channel is offline
     * @throws IllegalArgumentException if login is null or blank
     */
    public CompletableFuture<Optional<Stream>> getStreamByLogin(String login) {
        if (login == null || login.isBlank()) {
            throw new IllegalArgumentException("login must not be empty");
        }
        String normalized = login.trim().toLowerCase(Locale.ROOT);
        HttpRequest request = apiRequest("/streams?user_login=" + encode(normalized));

        return execute(apiClient, request, body -> {
            HelixStream entry = objectMapper.readValue(body, STREAMS_TYPE).first();
            if (entry == null) {
                return Optional.<Stream>empty();
            }
            return Optional.of(toStream(entry, normalized));
        });
    }

    /**
     * Look up a game (category) by id.
     *
     * @return the game, or empty when Twitch does not know the id
     * @throws IllegalArgumentException if gameId is null or blank
     */
    public CompletableFuture<Optional<Game>> getGame(String gameId) {
        if (gameId == null || gameId.isBlank()) {
            throw new IllegalArgumentException("gameId must not be empty");
        }
        HttpRequest request = apiRequest("/games?id=" + encode(gameId.trim()));

        return execute(apiClient, request, body -> {
            HelixGame entry = objectMapper.readValue(body, GAMES_TYPE).first();
            if (entry == null) {
                return Optional.<Game>empty();
            }
            return Optional.of(new Game(entry.getId(), entry.getName()));
        });
    }

    /**
     * Download the stream preview at 1920x1080.
     */
    public CompletableFuture<byte[]> getThumbnail(Stream stream) {
        return getThumbnail(stream, DEFAULT_THUMBNAIL_WIDTH, DEFAULT_THUMBNAIL_HEIGHT);
    }

    /**
     * Download the stream preview in full. The future only completes once every
     * byte has been received.
     */
    public CompletableFuture<byte[]> getThumbnail(Stream stream, int width, int height) {
        if (stream.thumbnailUrl() == null || stream.thumbnailUrl().isBlank()) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Stream of " + stream.login() + " has no thumbnail"));
        }
        String url = stream.thumbnailUrl(width, height);
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("User-Agent", USER_AGENT)
                    .timeout(requestTimeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new TwitchTransportException(url, e));
        }
        return execute(thumbnailClient, request, body -> body);
    }

    /**
     * Same as {@link #getThumbnail(Stream, int, int)} exposed as a stream over the
     * fully downloaded bytes.
     */
    public CompletableFuture<InputStream> openThumbnail(Stream stream, int width, int height) {
        return getThumbnail(stream, width, height).thenApply(ByteArrayInputStream::new);
    }

    private HttpRequest apiRequest(String pathAndQuery) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + pathAndQuery))
                .header("Client-ID", clientId)
                .header("User-Agent", USER_AGENT)
                .timeout(requestTimeout)
                .GET();
        if (accessToken != null && !accessToken.isBlank()) {
            builder.header("Authorization", "Bearer " + accessToken);
        }
        return builder.build();
    }

    private <T> CompletableFuture<T> execute(HttpClient client, HttpRequest request, BodyReader<T> reader) {
        String route = request.uri().toString();
        CompletableFuture<HttpResponse<byte[]>> call;
        try {
            call = client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new TwitchTransportException(route, e));
        }

        return call.handle((response, error) -> {
            if (error != null) {
                throw new TwitchTransportException(route, FutureUtils.unwrap(error));
            }

            int statusCode = response.statusCode();
            logger.debug("Twitch response status: {} for URL: {}", statusCode, route);

            if (statusCode < 200 || statusCode >= 300) {
                throw new TwitchApiException(route, statusCode, readReason(response.body(), statusCode));
            }

            try {
                return reader.read(response.body());
            } catch (IOException e) {
                throw new TwitchTransportException(route, e);
            }
        });
    }

    private Stream toStream(HelixStream entry, String login) throws IOException {
        if (entry.getStartedAt() == null || entry.getStartedAt().isBlank()) {
            throw new IOException("Stream entry for " + login + " has no started_at");
        }
        OffsetDateTime startedAt;
        try {
            startedAt = OffsetDateTime.parse(entry.getStartedAt());
        } catch (DateTimeParseException e) {
            throw new IOException("Invalid started_at for " + login + ": " + entry.getStartedAt(), e);
        }
        return new Stream(
                entry.getUserLogin() != null ? entry.getUserLogin() : login,
                entry.getUserName(),
                entry.getGameId() != null ? entry.getGameId() : "",
                entry.getTitle() != null ? entry.getTitle() : "",
                entry.getType(),
                entry.getThumbnailUrl(),
                startedAt,
                entry.getViewerCount() != null ? entry.getViewerCount() : 0
        );
    }

    /**
     * Prefer the "message" of a Helix error body, fall back to the raw text.
     */
    private String readReason(byte[] body, int statusCode) {
        if (body == null || body.length == 0) {
            return "HTTP " + statusCode;
        }
        try {
            HelixError error = objectMapper.readValue(body, HelixError.class);
            if (error.getMessage() != null && !error.getMessage().isBlank()) {
                return error.getMessage();
            }
            if (error.getError() != null && !error.getError().isBlank()) {
                return error.getError();
            }
        } catch (IOException e) {
            logger.trace("Error body is not Helix JSON", e);
        }
        return new String(body, StandardCharsets.UTF_8);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    @FunctionalInterface
    private interface BodyReader<T> {
        T read(byte[] body) throws IOException;
    }
}
