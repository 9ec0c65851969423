package de.alive.inboxscan.domain;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

public record Classification(@NotNull Set<CategoryTag> categories,
                             boolean personalized,
                             @Nullable UnsubscribeInfo unsubscribe) {

    public Classification {
        EnumSet<CategoryTag> copy = EnumSet.noneOf(CategoryTag.class);
        if (categories != null) {
            copy.addAll(categories);
        }
        categories = Collections.unmodifiableSet(copy);
    }

    public Optional<UnsubscribeInfo> unsubscribeInfo() {
        return Optional.ofNullable(unsubscribe);
    }

    public boolean hasCategories() {
        return !categories.isEmpty();
    }
}
