package de.alive.inboxscan.domain;

import org.jetbrains.annotations.NotNull;

public record PersonalizedRecord(@NotNull String senderName,
                                 @NotNull String senderAddress,
                                 @NotNull String rawHeaderBlock) {

    public static PersonalizedRecord of(NormalizedMessage message) {
        return new PersonalizedRecord(message.getSenderName(), message.getSenderAddress(), message.getRawHeaderBlock());
    }
}
