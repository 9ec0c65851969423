package de.alive.inboxscan.domain;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Aggregated statistics for all mail from one sender domain. Records are mutated while a scan
 * folds messages in and frozen once the scan completes.
 */
public class DomainRecord {

    @Getter
    @NotNull
    private final String domain;
    private final EnumSet<CategoryTag> categories = EnumSet.noneOf(CategoryTag.class);
    private final Set<String> uniqueSenders = new HashSet<>();
    private final List<String> senderList = new ArrayList<>();
    @Getter
    private int totalEmails;
    @Nullable
    private UnsubscribeInfo unsubscribe;
    @Getter
    @NotNull
    private Instant lastUpdated;
    private boolean frozen;

    private DomainRecord(@NotNull String domain, @NotNull Instant lastUpdated) {
        this.domain = domain;
        this.lastUpdated = lastUpdated;
    }

    public static DomainRecord seed(@NotNull NormalizedMessage message, @NotNull Classification classification) {
        DomainRecord record = new DomainRecord(message.getSenderDomain(), message.getArrivalDate());
        record.fold(message, classification);
        return record;
    }

    public void fold(@NotNull NormalizedMessage message, @NotNull Classification classification) {
        if (frozen) {
            throw new IllegalStateException("Domain record " + domain + " is frozen");
        }
        if (!domain.equals(message.getSenderDomain())) {
            throw new IllegalArgumentException(String.format(
                    "Message from %s cannot be folded into record for %s", message.getSenderDomain(), domain));
        }

        categories.addAll(classification.categories());
        if (uniqueSenders.add(message.getSenderAddress())) {
            senderList.add(message.getSenderAddress());
        }
        totalEmails++;

        if (classification.unsubscribe() != null) {
            unsubscribe = classification.unsubscribe();
            lastUpdated = message.getArrivalDate();
        }
    }

    public DomainRecord frozenCopy() {
        DomainRecord copy = new DomainRecord(domain, lastUpdated);
        copy.categories.addAll(categories);
        copy.uniqueSenders.addAll(uniqueSenders);
        copy.senderList.addAll(senderList);
        copy.totalEmails = totalEmails;
        copy.unsubscribe = unsubscribe;
        copy.frozen = true;
        return copy;
    }

    public Set<CategoryTag> getCategories() {
        return Collections.unmodifiableSet(categories);
    }

    public Set<String> getUniqueSenders() {
        return Collections.unmodifiableSet(uniqueSenders);
    }

    public List<String> getSenderList() {
        return Collections.unmodifiableList(senderList);
    }

    public Optional<UnsubscribeInfo> getUnsubscribe() {
        return Optional.ofNullable(unsubscribe);
    }

    public boolean isFrozen() {
        return frozen;
    }

    // messages without any sender share the empty domain and are never reported
    public boolean isReportable() {
        return totalEmails >= 2 && !domain.isBlank();
    }

    @Override
    public String toString() {
        return String.format("DomainRecord{domain=%s, emails=%d, senders=%d, categories=%s}",
                domain, totalEmails, uniqueSenders.size(), categories);
    }
}
