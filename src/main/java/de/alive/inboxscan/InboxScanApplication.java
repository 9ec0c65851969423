package de.alive.inboxscan;

import de.alive.inboxscan.domain.ScanResult;
import de.alive.inboxscan.exception.ConfigurationException;
import de.alive.inboxscan.exception.MailConnectionException;
import de.alive.inboxscan.exception.PersistenceException;
import de.alive.inboxscan.infrastructure.ImapMailboxSource;
import de.alive.inboxscan.report.ReportBuilder;
import de.alive.inboxscan.report.ScanReportingService;
import de.alive.inboxscan.service.ConfigurationService;
import de.alive.inboxscan.service.InboxScanService;
import de.alive.inboxscan.service.config.ScanConfiguration;
import de.alive.inboxscan.store.FileScannedIdStore;
import de.alive.inboxscan.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;

import java.nio.file.Path;
import java.time.Instant;

@Slf4j
public class InboxScanApplication {

    private final Configuration configuration;
    private final ReportBuilder reportBuilder = new ReportBuilder();
    private final ScanReportingService reportingService = new ScanReportingService();

    public InboxScanApplication(Configuration configuration) {
        this.configuration = configuration;
    }

    public static void main(String[] args) {
        log.info("{} Starting inbox scan...", LogUtils.ROCKET_EMOJI);
        try {
            Configuration configuration = new ConfigurationService().loadConfiguration();
            new InboxScanApplication(configuration).run();
        } catch (ConfigurationException e) {
            log.error("{} Invalid configuration ({}): {}", LogUtils.ERROR_EMOJI, e.getConfigKey(), e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            log.error("{} Scan failed: {}", LogUtils.ERROR_EMOJI, e.getMessage(), e);
            System.exit(1);
        }
    }

    public void run() throws MailConnectionException {
        ScanConfiguration scanConfig = configuration.scanConfig();
        FileScannedIdStore store = new FileScannedIdStore(scanConfig.getScannedIdsFile());

        try (ImapMailboxSource mailbox = new ImapMailboxSource(configuration)) {
            InboxScanService scanService = new InboxScanService(mailbox, store, scanConfig);

            // Scan
            ScanResult result;
            try {
                result = scanService.scan().block();
            } catch (RuntimeException e) {
                Throwable cause = Exceptions.unwrap(e);
                if (cause instanceof MailConnectionException) {
                    throw (MailConnectionException) cause;
                }
                throw e;
            }
            if (result == null) {
                log.warn("{} Scan produced no result", LogUtils.WARNING_EMOJI);
                return;
            }

            // Reports first, ids are only committed once they are on disk
            writeReports(result, scanConfig.getOutputDirectory());
            scanService.commit(result);
            reportingService.logScanReport(result);
        }
    }

    private void writeReports(ScanResult result, Path directory) {
        Instant now = Instant.now();
        try {
            Path personalized = reportBuilder.writePersonalizedReport(result.personalizedRecords(), directory, now);
            Path domains = reportBuilder.writeDomainReport(result.domainRecords(), directory, now);
            Path selection = reportBuilder.writeSelectionTemplate(result.domainRecords(), directory, now);
            log.info("{} Reports written: {}, {}, {}", LogUtils.SAVE_EMOJI, personalized, domains, selection);
        } catch (PersistenceException e) {
            log.error("{} Reports could not be written, scanned ids are left unchanged", LogUtils.ERROR_EMOJI);
            throw e;
        }
    }
}
