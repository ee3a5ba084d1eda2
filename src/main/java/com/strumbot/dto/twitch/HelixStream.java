package com.strumbot.dto.twitch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entry of GET /helix/streams.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HelixStream {

    private String id;

    @JsonProperty("user_login")
    private String userLogin;

    @JsonProperty("user_name")
    private String userName;

    @JsonProperty("game_id")
    private String gameId;

    @JsonProperty("game_name")
    private String gameName;

    /**
     * "live", or another value for reruns and the like.
     */
    private String type;

    private String title;

    @JsonProperty("viewer_count")
    private Integer viewerCount;

    /**
     * ISO 8601 timestamp, e.g. "2020-03-01T18:02:41Z".
     */
    @JsonProperty("started_at")
    private String startedAt;

    /**
     * Template with {width} and {height} placeholders.
     */
    @JsonProperty("thumbnail_url")
    private String thumbnailUrl;
}
