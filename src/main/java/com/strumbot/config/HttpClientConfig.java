package com.strumbot.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP clients for outbound calls.
 *
 * Twitch metadata and thumbnail downloads each get their own client backed by a
 * separately sized executor, so large image transfers cannot starve polling.
 * Webhook delivery goes through a blocking {@link RestTemplate} run on its own
 * small executor.
 */
@Configuration
public class HttpClientConfig {

    private final StrumbotProperties properties;

    public HttpClientConfig(StrumbotProperties properties) {
        this.properties = properties;
    }

    @Bean(name = "twitchApiExecutor", destroyMethod = "shutdownNow")
    public ExecutorService twitchApiExecutor() {
        return Executors.newFixedThreadPool(properties.getPool().getMetadataThreads(),
                daemonThreads("twitch-api-"));
    }

    @Bean(name = "twitchThumbnailExecutor", destroyMethod = "shutdownNow")
    public ExecutorService twitchThumbnailExecutor() {
        return Executors.newFixedThreadPool(properties.getPool().getThumbnailThreads(),
                daemonThreads("twitch-thumbnail-"));
    }

    @Bean("twitchApiHttpClient")
    public HttpClient twitchApiHttpClient(@Qualifier("twitchApiExecutor") ExecutorService executor) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getTwitch().getConnectTimeout())
                .executor(executor)
                .build();
    }

    @Bean("twitchThumbnailHttpClient")
    public HttpClient twitchThumbnailHttpClient(@Qualifier("twitchThumbnailExecutor") ExecutorService executor) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getTwitch().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .executor(executor)
                .build();
    }

    @Bean(name = "webhookExecutor", destroyMethod = "shutdownNow")
    public ExecutorService webhookExecutor() {
        return Executors.newFixedThreadPool(properties.getPool().getWebhookThreads(),
                daemonThreads("webhook-"));
    }

    @Bean("webhookRestTemplate")
    public RestTemplate webhookRestTemplate() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getTwitch().getConnectTimeout());
        factory.setReadTimeout(properties.getTwitch().getRequestTimeout());
        return new RestTemplate(factory);
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}
