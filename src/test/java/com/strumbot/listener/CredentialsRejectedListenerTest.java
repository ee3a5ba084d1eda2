package com.strumbot.listener;

import org.junit.jupiter.api.Test;
import org.springframework.context.support.GenericApplicationContext;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialsRejectedListenerTest {

    @Test
    void onCredentialsRejected_ClosesContextAndExitsWithNonZeroCode() throws Exception {
        // Given
        GenericApplicationContext context = new GenericApplicationContext();
        context.refresh();
        CompletableFuture<Integer> exitCode = new CompletableFuture<>();
        CredentialsRejectedListener listener = new CredentialsRejectedListener(context, exitCode::complete);

        // When
        listener.onCredentialsRejected(new TwitchCredentialsRejectedEvent(this, "alpha", 5, 401));

        // Then
        assertThat(exitCode.get(5, TimeUnit.SECONDS)).isEqualTo(CredentialsRejectedListener.EXIT_CODE);
        assertThat(context.isActive()).isFalse();
    }

    @Test
    void onCredentialsRejected_RepeatedEvents_ShutsDownOnce() throws Exception {
        // Given
        GenericApplicationContext context = new GenericApplicationContext();
        context.refresh();
        CompletableFuture<Integer> exitCode = new CompletableFuture<>();
        int[] exits = {0};
        CredentialsRejectedListener listener = new CredentialsRejectedListener(context, code -> {
            exits[0]++;
            exitCode.complete(code);
        });

        // When
        listener.onCredentialsRejected(new TwitchCredentialsRejectedEvent(this, "alpha", 5, 401));
        listener.onCredentialsRejected(new TwitchCredentialsRejectedEvent(this, "beta", 5, 401));
        exitCode.get(5, TimeUnit.SECONDS);

        // Then
        assertThat(exits[0]).isEqualTo(1);
    }
}
