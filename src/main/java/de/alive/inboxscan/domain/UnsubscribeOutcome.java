package de.alive.inboxscan.domain;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;

public record UnsubscribeOutcome(@NotNull String domain,
                                 @NotNull String token,
                                 @NotNull Instant attemptedAt,
                                 @NotNull Result result,
                                 @NotNull String detail,
                                 int attempts) {

    public enum Result {
        SUCCESS,
        FAILED,
        MANUAL_REQUIRED
    }

    public boolean isSuccess() {
        return result == Result.SUCCESS;
    }
}
