package com.strumbot.service.impl;

import com.strumbot.dto.NotificationMessage;
import com.strumbot.dto.discord.Attachment;
import com.strumbot.dto.discord.Embed;
import com.strumbot.dto.discord.EmbedField;
import com.strumbot.dto.discord.EmbedImage;
import com.strumbot.dto.discord.WebhookPayload;
import com.strumbot.exception.NotificationDeliveryException;
import com.strumbot.service.NotificationPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.http.converter.HttpMessageConversionException;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Posts notifications to a Discord incoming webhook as a single embed, with the
 * optional image uploaded as a multipart attachment.
 *
 * One attempt per message; failures are reported through the returned future.
 */
public class DiscordWebhookNotificationPublisher implements NotificationPublisher {

    private static final Logger logger = LoggerFactory.getLogger(DiscordWebhookNotificationPublisher.class);

    private static final String USER_AGENT = "Strumbot/1.0";

    private final RestTemplate restTemplate;
    private final Executor executor;
    private final MeterRegistry meterRegistry;
    private final URI webhookUri;
    private final String username;

    /**
     * @throws IllegalArgumentException if the webhook URL is blank or not an http(s) URL
     */
    public DiscordWebhookNotificationPublisher(RestTemplate restTemplate,
                                               Executor executor,
                                               MeterRegistry meterRegistry,
                                               String webhookUrl,
                                               String username) {
        if (!StringUtils.hasText(webhookUrl) || !webhookUrl.trim().matches("https?://\\S+")) {
            throw new IllegalArgumentException("Webhook URL must be an http(s) URL, got '" + webhookUrl + "'");
        }
        this.restTemplate = restTemplate;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.webhookUri = UriComponentsBuilder.fromUriString(webhookUrl.trim())
                .queryParam("wait", "true")
                .build()
                .toUri();
        this.username = username;
    }

    @Override
    public CompletableFuture<Void> publish(NotificationMessage message) {
        try {
            return CompletableFuture.runAsync(() -> send(message), executor);
        } catch (RejectedExecutionException e) {
            recordSend("error");
            return CompletableFuture.failedFuture(
                    new NotificationDeliveryException("Webhook delivery rejected by executor", e));
        }
    }

    @Override
    public String getChannelName() {
        return "discord";
    }

    private void send(NotificationMessage message) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
        HttpEntity<MultiValueMap<String, HttpEntity<?>>> request = new HttpEntity<>(multipartBody(message), headers);

        try {
            ResponseEntity<String> response = restTemplate.exchange(webhookUri, HttpMethod.POST, request, String.class);
            logger.info("Webhook accepted notification '{}' (status {})",
                    message.getTitle(), response.getStatusCode().value());
            recordSend("success");
        } catch (RestClientResponseException e) {
            recordSend("rejected");
            throw NotificationDeliveryException.rejected(e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            recordSend("error");
            throw NotificationDeliveryException.unreachable(e.getCause() != null ? e.getCause() : e);
        } catch (HttpMessageConversionException e) {
            logger.error("Failed to serialize notification '{}'", message.getTitle(), e);
            recordSend("serialization_error");
            throw new NotificationDeliveryException("Failed to serialize notification", e);
        } catch (RestClientException e) {
            recordSend("error");
            throw NotificationDeliveryException.unreachable(e);
        }
    }

    /**
     * Discord execute-webhook payload: content, username and one embed.
     */
    WebhookPayload payload(NotificationMessage message) {
        Embed.EmbedBuilder embed = Embed.builder()
                .title(message.getTitle())
                .description(message.getDescription())
                .url(message.getUrl())
                .color(message.getColor());
        if (message.getTimestamp() != null) {
            embed.timestamp(message.getTimestamp().toString());
        }
        if (message.getFields() != null && !message.getFields().isEmpty()) {
            embed.fields(message.getFields().stream()
                    .map(field -> new EmbedField(field.name(), field.value(), field.inline()))
                    .toList());
        }
        if (message.hasImage()) {
            embed.image(new EmbedImage("attachment://" + message.getImageFileName()));
        }

        WebhookPayload.WebhookPayloadBuilder payload = WebhookPayload.builder()
                .content(message.getContent())
                .username(username)
                .embeds(List.of(embed.build()));
        if (message.hasImage()) {
            payload.attachments(List.of(new Attachment(0, message.getImageFileName())));
        }
        return payload.build();
    }

    MultiValueMap<String, HttpEntity<?>> multipartBody(NotificationMessage message) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("payload_json", payload(message), MediaType.APPLICATION_JSON);
        if (message.hasImage()) {
            String fileName = message.getImageFileName();
            MediaType imageType = MediaTypeFactory.getMediaType(fileName).orElse(MediaType.IMAGE_JPEG);
            builder.part("files[0]", new ByteArrayResource(message.getImageBytes()), imageType)
                    .filename(fileName);
        }
        return builder.build();
    }

    private void recordSend(String status) {
        meterRegistry.counter("strumbot_webhook_send_total", "status", status).increment();
    }
}
