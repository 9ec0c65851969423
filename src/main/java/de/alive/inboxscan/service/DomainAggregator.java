package de.alive.inboxscan.service;

import de.alive.inboxscan.domain.Classification;
import de.alive.inboxscan.domain.DomainRecord;
import de.alive.inboxscan.domain.NormalizedMessage;
import de.alive.inboxscan.domain.PersonalizedRecord;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
public class DomainAggregator {

    private final Map<String, DomainRecord> records = new LinkedHashMap<>();
    private final List<PersonalizedRecord> personalized = new ArrayList<>();

    public synchronized void accept(@NotNull NormalizedMessage message, @NotNull Classification classification) {
        // First message seeds the record
        DomainRecord record = records.get(message.getSenderDomain());
        if (record == null) {
            records.put(message.getSenderDomain(), DomainRecord.seed(message, classification));
            log.debug("New domain {}", message.getSenderDomain());
        } else {
            record.fold(message, classification);
        }

        if (classification.personalized()) {
            personalized.add(PersonalizedRecord.of(message));
        }
    }

    public synchronized Optional<DomainRecord> find(String domain) {
        return Optional.ofNullable(records.get(domain)).map(DomainRecord::frozenCopy);
    }

    /**
     * @return frozen copies of every record in first-seen order
     */
    public synchronized List<DomainRecord> snapshot() {
        return records.values().stream().map(DomainRecord::frozenCopy).toList();
    }

    public synchronized List<PersonalizedRecord> personalizedRecords() {
        return List.copyOf(personalized);
    }

    public synchronized int domainCount() {
        return records.size();
    }
}
