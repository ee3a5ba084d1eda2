package com.strumbot.config;

import com.strumbot.service.NotificationPublisher;
import com.strumbot.service.impl.DiscordWebhookNotificationPublisher;
import com.strumbot.service.impl.LoggingNotificationPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.ExecutorService;

/**
 * Selects the notification publisher: Discord when a webhook URL is configured,
 * otherwise a publisher that only logs.
 */
@Configuration
public class NotificationConfig {

    private static final Logger logger = LoggerFactory.getLogger(NotificationConfig.class);

    @Bean
    @Conditional(WebhookConfiguredCondition.class)
    public NotificationPublisher discordWebhookPublisher(
            @Qualifier("webhookRestTemplate") RestTemplate restTemplate,
            @Qualifier("webhookExecutor") ExecutorService executor,
            MeterRegistry meterRegistry,
            StrumbotProperties properties) {
        logger.info("Discord webhook notifications enabled");
        return new DiscordWebhookNotificationPublisher(restTemplate, executor, meterRegistry,
                properties.getDiscord().getWebhookUrl(), properties.getDiscord().getUsername());
    }

    @Bean
    @ConditionalOnMissingBean(NotificationPublisher.class)
    public NotificationPublisher loggingNotificationPublisher() {
        logger.info("Discord webhook not configured - notifications will only be logged");
        return new LoggingNotificationPublisher();
    }
}
