package de.alive.inboxscan.domain;

import org.jetbrains.annotations.NotNull;

public record UnsubscribeSelection(int rowNumber,
                                   @NotNull String domain,
                                   @NotNull String unsubscribeUrl,
                                   @NotNull String token,
                                   boolean delete,
                                   boolean unsubscribeAvailable) {

    public boolean isActionable() {
        return delete && unsubscribeAvailable;
    }

    public static boolean isAffirmative(String value) {
        return value != null && value.trim().equalsIgnoreCase("yes");
    }
}
