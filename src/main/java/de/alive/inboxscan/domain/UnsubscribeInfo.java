package de.alive.inboxscan.domain;

import org.jetbrains.annotations.NotNull;

public record UnsubscribeInfo(@NotNull String url, @NotNull String token, @NotNull Mechanism mechanism) {

    public enum Mechanism {
        HTTP,
        MAILTO
    }

    public UnsubscribeInfo {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Unsubscribe URL cannot be null or empty");
        }
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Unsubscribe token cannot be null or empty");
        }
        if (mechanism == null) {
            throw new IllegalArgumentException("Unsubscribe mechanism cannot be null");
        }
    }

    public boolean isAutomatable() {
        return mechanism == Mechanism.HTTP;
    }
}
