package de.alive.inboxscan.report;

import de.alive.inboxscan.domain.CategoryTag;
import de.alive.inboxscan.domain.DomainRecord;
import de.alive.inboxscan.domain.ScanResult;
import de.alive.inboxscan.domain.ScanStatistics;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class ScanReportingService {

    private static final int TOP_DOMAIN_COUNT = 10;

    public void logScanReport(ScanResult result) {
        logStatistics(result.statistics(), result);
        logTopDomains(result.reportableDomains());
        logCategoryBreakdown(result.domainRecords());
    }

    private void logStatistics(ScanStatistics statistics, ScanResult result) {
        long withUnsubscribe = result.reportableDomains().stream()
                .filter(record -> record.getUnsubscribe().isPresent())
                .count();

        log.info("");
        log.info("🎯 ================ INBOX SCAN REPORT ================");
        log.info("📧 Candidate messages: {}", statistics.candidates());
        log.info("🆕 Newly processed: {}", statistics.processed());
        log.info("⚡ Skipped (already scanned): {}", statistics.alreadyScanned());
        log.info("❌ Decode errors: {}", statistics.decodeErrors());
        log.info("👤 Personalized messages: {}", result.personalizedRecords().size());
        log.info("🏷️ Domains seen: {} ({} reported)", result.domainRecords().size(), result.reportableDomains().size());
        log.info("🔗 Reported domains with unsubscribe info: {}", withUnsubscribe);
    }

    private void logTopDomains(List<DomainRecord> reportable) {
        if (reportable.isEmpty()) {
            log.info("No domain sent more than one message");
            return;
        }
        log.info("");
        log.info("🏷️ TOP DOMAINS:");
        ReportBuilder.reportable(reportable).stream()
                .limit(TOP_DOMAIN_COUNT)
                .forEach(record -> log.info("   {} emails - {} ({})",
                        record.getTotalEmails(), record.getDomain(), ReportBuilder.joinCategories(record)));
    }

    private void logCategoryBreakdown(List<DomainRecord> records) {
        Map<CategoryTag, Integer> counts = new EnumMap<>(CategoryTag.class);
        for (DomainRecord record : records) {
            record.getCategories().forEach(tag -> counts.merge(tag, 1, Integer::sum));
        }
        if (counts.isEmpty()) {
            return;
        }
        log.info("");
        log.info("📮 DOMAINS BY CATEGORY:");
        counts.forEach((tag, count) -> log.info("   {}: {}", tag.getDisplayName(), count));
    }
}
