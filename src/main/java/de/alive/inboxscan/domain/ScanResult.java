package de.alive.inboxscan.domain;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Set;

public record ScanResult(@NotNull List<DomainRecord> domainRecords,
                         @NotNull List<PersonalizedRecord> personalizedRecords,
                         @NotNull Set<String> newlyScannedIds,
                         @NotNull ScanStatistics statistics) {

    public ScanResult {
        domainRecords = List.copyOf(domainRecords);
        personalizedRecords = List.copyOf(personalizedRecords);
        newlyScannedIds = Set.copyOf(newlyScannedIds);
    }

    public List<DomainRecord> reportableDomains() {
        return domainRecords.stream().filter(DomainRecord::isReportable).toList();
    }
}
