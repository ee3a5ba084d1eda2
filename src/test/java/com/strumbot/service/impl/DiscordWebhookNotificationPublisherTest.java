package com.strumbot.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strumbot.dto.NotificationMessage;
import com.strumbot.dto.discord.Embed;
import com.strumbot.dto.discord.WebhookPayload;
import com.strumbot.exception.NotificationDeliveryException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withNoContent;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DiscordWebhookNotificationPublisherTest {

    private static final String WEBHOOK_URL = "https://discord.com/api/webhooks/123/abc";

    private final Executor direct = Runnable::run;

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private SimpleMeterRegistry meterRegistry;
    private DiscordWebhookNotificationPublisher publisher;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        meterRegistry = new SimpleMeterRegistry();
        publisher = new DiscordWebhookNotificationPublisher(restTemplate, direct, meterRegistry,
                WEBHOOK_URL, "Strumbot");
    }

    private static NotificationMessage message(byte[] image) {
        return NotificationMessage.builder()
                .content("@here")
                .title("Alpha is live!")
                .description("Speedrunning")
                .url("https://twitch.tv/alpha")
                .color(0x6441A5)
                .field(new NotificationMessage.Field("Playing", "Celeste", true))
                .timestamp(Instant.parse("2024-01-01T10:00:00Z"))
                .imageBytes(image)
                .imageFileName(image != null ? "thumbnail.jpg" : null)
                .build();
    }

    private double sends(String status) {
        return meterRegistry.counter("strumbot_webhook_send_total", "status", status).count();
    }

    @Nested
    @DisplayName("payload")
    class PayloadTests {

        @Test
        @DisplayName("should map the message onto one embed")
        void payload_MapsEmbed() {
            // When
            WebhookPayload payload = publisher.payload(message(null));

            // Then
            assertThat(payload.getContent()).isEqualTo("@here");
            assertThat(payload.getUsername()).isEqualTo("Strumbot");
            assertThat(payload.getAttachments()).isNull();
            assertThat(payload.getEmbeds()).hasSize(1);
            Embed embed = payload.getEmbeds().get(0);
            assertThat(embed.getTitle()).isEqualTo("Alpha is live!");
            assertThat(embed.getDescription()).isEqualTo("Speedrunning");
            assertThat(embed.getUrl()).isEqualTo("https://twitch.tv/alpha");
            assertThat(embed.getColor()).isEqualTo(0x6441A5);
            assertThat(embed.getTimestamp()).isEqualTo("2024-01-01T10:00:00Z");
            assertThat(embed.getImage()).isNull();
        }

        @Test
        @DisplayName("should serialize without null members")
        void payload_Json_OmitsNulls() throws Exception {
            // Given
            NotificationMessage bare = NotificationMessage.builder().title("Beta is offline").build();

            // When
            JsonNode json = new ObjectMapper().valueToTree(publisher.payload(bare));

            // Then
            assertThat(json.has("content")).isFalse();
            assertThat(json.has("attachments")).isFalse();
            assertThat(json.at("/embeds/0/title").asText()).isEqualTo("Beta is offline");
            assertThat(json.at("/embeds/0").has("image")).isFalse();
            assertThat(json.at("/embeds/0").has("fields")).isFalse();
        }

        @Test
        @DisplayName("should reference the uploaded file when an image is present")
        void multipartBody_WithImage_ContainsBothParts() {
            // When
            MultiValueMap<String, HttpEntity<?>> body = publisher.multipartBody(message(new byte[]{'J', 'P', 'G'}));

            // Then
            assertThat(body.keySet()).containsExactly("payload_json", "files[0]");
            HttpEntity<?> json = body.getFirst("payload_json");
            assertThat(json.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
            WebhookPayload payload = (WebhookPayload) json.getBody();
            assertThat(payload.getEmbeds().get(0).getImage().getUrl()).isEqualTo("attachment://thumbnail.jpg");
            assertThat(payload.getAttachments().get(0).getFilename()).isEqualTo("thumbnail.jpg");
            assertThat(payload.getEmbeds().get(0).getFields().get(0).isInline()).isTrue();

            HttpEntity<?> file = body.getFirst("files[0]");
            assertThat(file.getHeaders().getContentType()).isEqualTo(MediaType.IMAGE_JPEG);
            assertThat(file.getHeaders().getContentDisposition().getFilename()).isEqualTo("thumbnail.jpg");
        }

        @Test
        @DisplayName("should omit the file part without an image")
        void multipartBody_WithoutImage_OnlyPayload() {
            MultiValueMap<String, HttpEntity<?>> body = publisher.multipartBody(message(null));

            assertThat(body.keySet()).containsExactly("payload_json");
        }
    }

    @Nested
    @DisplayName("publish")
    class PublishTests {

        @Test
        @DisplayName("should post multipart to the webhook with wait=true")
        void publish_Success_PostsMultipart() {
            // Given
            server.expect(requestTo(WEBHOOK_URL + "?wait=true"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(header(HttpHeaders.CONTENT_TYPE, containsString("multipart/form-data")))
                    .andExpect(header(HttpHeaders.USER_AGENT, "Strumbot/1.0"))
                    .andExpect(content().string(containsString("name=\"payload_json\"")))
                    .andExpect(content().string(containsString("filename=\"thumbnail.jpg\"")))
                    .andExpect(content().string(containsString("Content-Type: image/jpeg")))
                    .andExpect(content().string(containsString("\"title\":\"Alpha is live!\"")))
                    .andRespond(withNoContent());

            // When
            publisher.publish(message(new byte[]{'J', 'P', 'G'})).join();

            // Then
            server.verify();
            assertThat(sends("success")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should send only the payload part without an image")
        void publish_WithoutImage_NoFilePart() {
            // Given
            server.expect(requestTo(WEBHOOK_URL + "?wait=true"))
                    .andExpect(content().string(not(containsString("files[0]"))))
                    .andRespond(withSuccess("{\"id\":\"1\"}", MediaType.APPLICATION_JSON));

            // When
            publisher.publish(message(null)).join();

            // Then
            server.verify();
        }

        @Test
        @DisplayName("should keep existing query parameters")
        void publish_UrlWithQuery_AppendsWait() {
            // Given
            publisher = new DiscordWebhookNotificationPublisher(restTemplate, direct, meterRegistry,
                    WEBHOOK_URL + "?thread_id=42", "Strumbot");
            server.expect(requestTo(WEBHOOK_URL + "?thread_id=42&wait=true")).andRespond(withNoContent());

            // When
            publisher.publish(message(null)).join();

            // Then
            server.verify();
        }

        @Test
        @DisplayName("should fail with the status and body when Discord rejects the message")
        void publish_Rejected_FailsWithStatus() {
            // Given
            server.expect(requestTo(WEBHOOK_URL + "?wait=true"))
                    .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                            .contentType(MediaType.APPLICATION_JSON)
                            .body("{\"message\": \"Cannot send an empty message\", \"code\": 50006}"));

            // When/Then
            assertThatThrownBy(() -> publisher.publish(message(null)).join())
                    .isInstanceOf(CompletionException.class)
                    .cause()
                    .isInstanceOf(NotificationDeliveryException.class)
                    .hasMessageContaining("400")
                    .hasMessageContaining("Cannot send an empty message")
                    .satisfies(e -> assertThat(((NotificationDeliveryException) e).getStatus()).isEqualTo(400));
            assertThat(sends("rejected")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should fail with status -1 when Discord is unreachable")
        void publish_Unreachable_FailsWithoutStatus() {
            // Given
            server.expect(requestTo(WEBHOOK_URL + "?wait=true"))
                    .andRespond(withException(new IOException("connection reset")));

            // When/Then
            assertThatThrownBy(() -> publisher.publish(message(null)).join())
                    .cause()
                    .isInstanceOf(NotificationDeliveryException.class)
                    .satisfies(e -> {
                        NotificationDeliveryException ex = (NotificationDeliveryException) e;
                        assertThat(ex.getStatus()).isEqualTo(-1);
                        assertThat(ex.getCause()).isInstanceOf(IOException.class);
                    });
            assertThat(sends("error")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should report a full delivery executor through the future")
        void publish_ExecutorRejects_ReturnsFailedFuture() {
            // Given
            Executor full = task -> {
                throw new RejectedExecutionException("queue full");
            };
            publisher = new DiscordWebhookNotificationPublisher(restTemplate, full, meterRegistry,
                    WEBHOOK_URL, "Strumbot");

            // When
            CompletableFuture<Void> result = publisher.publish(message(null));

            // Then
            assertThat(result).isCompletedExceptionally();
            assertThatThrownBy(result::join)
                    .cause()
                    .isInstanceOf(NotificationDeliveryException.class)
                    .hasCauseInstanceOf(RejectedExecutionException.class);
            assertThat(sends("error")).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("construction")
    class ConstructionTests {

        @Test
        @DisplayName("should refuse a blank webhook URL")
        void blankUrl_Throws() {
            assertThatThrownBy(() -> new DiscordWebhookNotificationPublisher(restTemplate, direct, meterRegistry,
                    "", "Strumbot"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new DiscordWebhookNotificationPublisher(restTemplate, direct, meterRegistry,
                    "   ", "Strumbot"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should refuse a URL without an http scheme")
        void urlWithoutScheme_Throws() {
            assertThatThrownBy(() -> new DiscordWebhookNotificationPublisher(restTemplate, direct, meterRegistry,
                    "discord.com/api/webhooks/1/token", "Strumbot"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("http(s)");
        }

        @Test
        @DisplayName("should accept surrounding whitespace")
        void urlWithWhitespace_Trimmed() {
            assertThatCode(() -> new DiscordWebhookNotificationPublisher(restTemplate, direct, meterRegistry,
                    " " + WEBHOOK_URL + " ", "Strumbot"))
                    .doesNotThrowAnyException();
        }
    }
}
