package com.strumbot.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class StrumbotPropertiesTest {

    @Test
    void defaults_MatchDocumentedValues() {
        StrumbotProperties properties = new StrumbotProperties();

        assertThat(properties.getPollInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(properties.getInitialDelay()).isEqualTo(Duration.ZERO);
        assertThat(properties.getTwitch().getBaseUrl()).isEqualTo("https://api.twitch.tv/helix");
        assertThat(properties.getTwitch().getMaxAuthFailures()).isEqualTo(5);
        assertThat(properties.getThumbnail().getWidth()).isEqualTo(1920);
        assertThat(properties.getThumbnail().getHeight()).isEqualTo(1080);
        assertThat(properties.getPool().getWorkerThreads()).isEqualTo(4);
        assertThat(properties.getDiscord().getUsername()).isEqualTo("Strumbot");
    }

    @Test
    void getNormalizedChannels_LowercasesTrimsAndDeduplicates() {
        // Given
        StrumbotProperties properties = new StrumbotProperties();
        properties.setChannels(Arrays.asList(" Alpha", "beta", "ALPHA", "", null, "Gamma "));

        // When/Then
        assertThat(properties.getNormalizedChannels()).containsExactly("alpha", "beta", "gamma");
    }

    @Test
    void webhookUrl_BlankOrHttp_IsValid() {
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

        for (String url : Arrays.asList(null, "", "  ", "https://discord.com/api/webhooks/1/token",
                "http://localhost:8080/hook")) {
            StrumbotProperties.Discord discord = new StrumbotProperties.Discord();
            discord.setWebhookUrl(url);
            assertThat(validator.validate(discord)).as("webhook url %s", url).isEmpty();
        }
    }

    @Test
    void webhookUrl_WithoutScheme_IsRejected() {
        // Given
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        StrumbotProperties properties = new StrumbotProperties();
        properties.setChannels(List.of("alpha"));
        properties.getTwitch().setClientId("client-id");
        properties.getDiscord().setWebhookUrl("discord.com/api/webhooks/1/token");

        // When
        Set<ConstraintViolation<StrumbotProperties>> violations = validator.validate(properties);

        // Then
        assertThat(violations).hasSize(1);
        assertThat(violations.iterator().next().getPropertyPath().toString()).isEqualTo("discord.webhookUrl");
    }
}
