package de.alive.inboxscan.domain;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

public record DecodeResult(long uid, @Nullable NormalizedMessage message, @Nullable String failureReason) {

    public static DecodeResult ok(@NotNull NormalizedMessage message) {
        return new DecodeResult(message.getUid(), message, null);
    }

    public static DecodeResult failed(long uid, @NotNull String reason) {
        return new DecodeResult(uid, null, reason);
    }

    public boolean isOk() {
        return message != null;
    }

    public Optional<NormalizedMessage> asOptional() {
        return Optional.ofNullable(message);
    }
}
