package de.alive.inboxscan.classification;

import de.alive.inboxscan.domain.NormalizedMessage;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;

public record MatchRule(@NotNull String keyword, @NotNull Field field) {

    public enum Field {
        ANY,
        DOMAIN,
        ADDRESS,
        SUBJECT
    }

    public MatchRule {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("Match keyword cannot be null or empty");
        }
        if (field == null) {
            throw new IllegalArgumentException("Match field cannot be null");
        }
        keyword = keyword.trim().toLowerCase(Locale.ROOT);
    }

    public static MatchRule anywhere(String keyword) {
        return new MatchRule(keyword, Field.ANY);
    }

    public static MatchRule inSubject(String keyword) {
        return new MatchRule(keyword, Field.SUBJECT);
    }

    public static MatchRule inDomain(String keyword) {
        return new MatchRule(keyword, Field.DOMAIN);
    }

    public boolean matches(@NotNull NormalizedMessage message) {
        return switch (field) {
            case ANY -> contains(message.getSenderDomain())
                    || contains(message.getSenderAddress())
                    || contains(message.getSubject());
            case DOMAIN -> contains(message.getSenderDomain());
            case ADDRESS -> contains(message.getSenderAddress());
            case SUBJECT -> contains(message.getSubject());
        };
    }

    private boolean contains(String value) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(keyword);
    }
}
