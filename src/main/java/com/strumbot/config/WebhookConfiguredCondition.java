package com.strumbot.config;

import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.util.StringUtils;

/**
 * Matches when {@code strumbot.discord.webhook-url} holds a non-blank value.
 * An empty value (e.g. {@code STRUMBOT_DISCORD_WEBHOOK_URL=}) counts as unset.
 */
public class WebhookConfiguredCondition implements Condition {

    static final String WEBHOOK_URL_PROPERTY = "strumbot.discord.webhook-url";

    @Override
    public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
        return StringUtils.hasText(context.getEnvironment().getProperty(WEBHOOK_URL_PROPERTY));
    }
}
