package de.alive.inboxscan.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

@Getter
@Builder
@ToString(exclude = {"bodyText", "rawHeaderBlock"})
public class NormalizedMessage {

    @NotNull
    private final String messageId;
    private final long uid;
    @NotNull
    private final Instant arrivalDate;

    @NotNull
    private final String senderName;
    @NotNull
    private final String senderAddress;
    @NotNull
    private final String senderDomain;

    @NotNull
    private final String subject;
    @NotNull
    private final String bodyText;
    @NotNull
    private final String rawHeaderBlock;

    // decoded List-Unsubscribe header, if the message carries one
    @Nullable
    private final String listUnsubscribe;
}
